package org.caureq.caureqspeedboard.service.render;

import org.caureq.caureqspeedboard.domain.*;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Turns an {@link AggregatedView} into Telegram HTML.
 *
 * Output depends only on the arguments: ages are measured against the view's generatedAt,
 * numbers use {@link Locale#ROOT}, and the language only swaps phrases.
 */
@Component
public class DigestRenderer {

    private static final String SEPARATOR = "———";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ROOT);

    public String render(AggregatedView view, RecipientPref pref) {
        return render(view, pref.getLanguage(), pref.getViewMode());
    }

    public String render(AggregatedView view, Language language, ViewMode mode) {
        var lang = language == null ? Language.FALLBACK : language;
        return mode == ViewMode.DETAILED ? detailed(view, lang) : compact(view, lang);
    }

    private String compact(AggregatedView view, Language lang) {
        var out = new StringJoiner("\n");
        out.add(header(view, lang));
        out.add("");
        if (view.nodes().isEmpty()) {
            out.add(Labels.get("no_nodes", lang));
            return out.toString();
        }
        for (var node : view.nodes()) {
            var name = nodeTitle(node.meta());
            if (node.online()) {
                var r = node.report();
                out.add("%s — %s %s Mbps ↓ / %s ↑, %s ms".formatted(
                        name, node.tier().glyph(), mbps(r.downloadMbps()), mbps(r.uploadMbps()), ms(r.pingMs())));
            } else {
                out.add("%s — %s %s".formatted(name, NodeHealth.STALE.glyph(), Labels.get("no_data", lang)));
            }
        }
        return out.toString();
    }

    private String detailed(AggregatedView view, Language lang) {
        var out = new StringJoiner("\n");
        out.add(header(view, lang));
        out.add("%s <b>%s: %s</b>".formatted(view.clusterStatus().glyph(),
                Labels.get("status", lang), Labels.cluster(view.clusterStatus(), lang)));
        var s = view.summary();
        out.add("%s: %s %d · %s %d · %s %d".formatted(Labels.get("summary", lang),
                NodeHealth.OK.glyph(), s.get(NodeHealth.OK),
                NodeHealth.DEGRADED.glyph(), s.get(NodeHealth.DEGRADED),
                NodeHealth.STALE.glyph(), s.get(NodeHealth.STALE)));
        if (view.nodes().isEmpty()) {
            out.add("");
            out.add(Labels.get("no_nodes", lang));
            return out.toString();
        }
        boolean first = true;
        for (var node : view.nodes()) {
            out.add("");
            if (!first) {
                out.add(SEPARATOR);
                out.add("");
            }
            first = false;
            out.add("<b>" + nodeTitle(node.meta()) + "</b>");
            if (node.online()) {
                nodeBlock(out, node, view.generatedAt(), lang);
            } else {
                out.add("%s %s (%s)".formatted(NodeHealth.STALE.glyph(), Labels.get("no_data", lang),
                        staleReason(node, view.generatedAt(), lang)));
            }
        }
        return out.toString();
    }

    private void nodeBlock(StringJoiner out, NodeView node, Instant now, Language lang) {
        var r = node.report();
        out.add("⬇️ %s: %s Mbps".formatted(Labels.get("download", lang), mbps(r.downloadMbps())));
        out.add("⬆️ %s: %s Mbps".formatted(Labels.get("upload", lang), mbps(r.uploadMbps())));
        out.add("📡 %s: %s ms".formatted(Labels.get("ping", lang), ms(r.pingMs())));
        out.add("📈 %s: %s %s".formatted(Labels.get("status", lang), node.tier().glyph(), Labels.tier(node.tier(), lang)));
        optional(out, "🏢", Labels.get("isp", lang), r.isp());
        optional(out, "📍", Labels.get("location", lang), r.location());
        optional(out, "🌐", Labels.get("test_server", lang), r.testServer());
        optional(out, "💻", Labels.get("os", lang), r.osInfo());
        if (hasText(r.description())) out.add("📝 " + esc(r.description()));
        out.add("🕐 " + Labels.format("last_seen", lang, ageMinutes(r, now)));
    }

    private String staleReason(NodeView node, Instant now, Language lang) {
        var last = node.lastReport();
        if (last == null || last.capturedAt() == null) return Labels.get("never_reported", lang);
        return Labels.format("stale_since", lang, ageMinutes(last, now));
    }

    private String header(AggregatedView view, Language lang) {
        return "<b>%s</b> (%s)".formatted(Labels.get("title", lang), STAMP.format(view.generatedAt().atZone(view.zone())));
    }

    private static String nodeTitle(NodeMeta meta) {
        var name = esc(meta.label());
        return hasText(meta.flag()) ? meta.flag() + " " + name : name;
    }

    private static void optional(StringJoiner out, String glyph, String label, String value) {
        if (hasText(value)) out.add("%s %s: %s".formatted(glyph, label, esc(value)));
    }

    private static long ageMinutes(SpeedReport r, Instant now) {
        return Math.max(0, Duration.between(r.capturedAt(), now).toMinutes());
    }

    private static String mbps(double v) { return String.format(Locale.ROOT, "%.0f", v); }

    private static String ms(double v) { return String.format(Locale.ROOT, "%.1f", v); }

    private static boolean hasText(String s) { return s != null && !s.isBlank(); }

    private static String esc(String s) { return HtmlUtils.htmlEscape(s.trim(), "UTF-8"); }
}
