package org.caureq.caureqspeedboard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.caureq.caureqspeedboard.domain.Language;
import org.caureq.caureqspeedboard.domain.Tier;
import org.caureq.caureqspeedboard.domain.ViewMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProps(@NotBlank String apiToken,
                       @DefaultValue("master") String mode,
                       @DefaultValue("UTC") String timeZone,
                       @Valid @DefaultValue StatusProps status,
                       @Valid @DefaultValue ThresholdProps thresholds,
                       @Valid @DefaultValue ScheduleProps schedule,
                       @Valid @DefaultValue DefaultsProps defaults,
                       List<NodeProps> nodes,
                       List<RecipientProps> recipients) {

    public AppProps {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
    }

    public ZoneId zone() { return ZoneId.of(timeZone); }

    /** How long a node may stay silent before it is rendered as stale. */
    public record StatusProps(@Min(1) @DefaultValue("120") int staleMinutes) {
        public Duration staleWindow() { return Duration.ofMinutes(staleMinutes); }
    }

    /**
     * Lower bound (Mbps download) of each tier. A null bound makes its tier unreachable;
     * VERY_LOW is the floor either way.
     */
    public record ThresholdProps(@PositiveOrZero @DefaultValue("50") Double veryLow,
                                 @PositiveOrZero @DefaultValue("200") Double low,
                                 @PositiveOrZero @DefaultValue("500") Double medium,
                                 @PositiveOrZero @DefaultValue("1000") Double good,
                                 @PositiveOrZero Double excellent) {

        public Map<Tier, Double> bounds() {
            var m = new EnumMap<Tier, Double>(Tier.class);
            if (veryLow != null) m.put(Tier.VERY_LOW, veryLow);
            if (low != null) m.put(Tier.LOW, low);
            if (medium != null) m.put(Tier.MEDIUM, medium);
            if (good != null) m.put(Tier.GOOD, good);
            if (excellent != null) m.put(Tier.EXCELLENT, excellent);
            return m;
        }

        @AssertTrue(message = "thresholds must be non-decreasing from very-low to excellent")
        public boolean isOrdered() {
            double prev = Double.NEGATIVE_INFINITY;
            for (var b : bounds().values()) {
                if (b < prev) return false;
                prev = b;
            }
            return true;
        }
    }

    public record ScheduleProps(@Min(1) @DefaultValue("60") int intervalMinutes,
                                @PositiveOrZero Integer initialDelayMinutes,
                                @DefaultValue("false") boolean sendImmediately) {}

    public record DefaultsProps(@DefaultValue("en") String language,
                                @DefaultValue("compact") String viewMode) {
        public Language lang() { return Language.fromCode(language); }
        public ViewMode view() { return ViewMode.fromCode(viewMode); }
    }

    /** Display metadata; list position is the order rank. */
    public record NodeProps(@NotBlank String id, String flag, String displayName) {}

    /** A digest destination. Missing defaults fall back to {@link DefaultsProps}. */
    public record RecipientProps(@NotBlank String chatId, String defaultLanguage, String defaultViewMode) {}
}
