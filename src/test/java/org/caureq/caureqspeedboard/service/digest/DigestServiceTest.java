package org.caureq.caureqspeedboard.service.digest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.caureq.caureqspeedboard.Fixtures.props;
import static org.caureq.caureqspeedboard.Fixtures.recipient;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.caureq.caureqspeedboard.domain.AggregatedView;
import org.caureq.caureqspeedboard.domain.ClusterStatus;
import org.caureq.caureqspeedboard.domain.Language;
import org.caureq.caureqspeedboard.domain.RecipientPref;
import org.caureq.caureqspeedboard.domain.ViewMode;
import org.caureq.caureqspeedboard.service.AggregatorService;
import org.caureq.caureqspeedboard.service.prefs.PreferenceStore;
import org.caureq.caureqspeedboard.service.prefs.RecipientDefaults;
import org.caureq.caureqspeedboard.service.render.DigestRenderer;
import org.caureq.caureqspeedboard.service.telegram.PreferenceKeyboard;
import org.caureq.caureqspeedboard.service.telegram.TelegramApiException;
import org.caureq.caureqspeedboard.service.telegram.TelegramClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;

@ExtendWith(MockitoExtension.class)
class DigestServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private AggregatorService aggregator;

    @Mock
    private PreferenceStore prefs;

    @Mock
    private TelegramClient telegram;

    private DigestService digests;

    @BeforeEach
    void setUp() {
        var recipients = new RecipientDefaults(props(List.of(),
                List.of(recipient("a", null, null), recipient("b", "ru", null))));
        digests = new DigestService(aggregator, prefs, recipients, new DigestRenderer(), new PreferenceKeyboard(),
                telegram, new SyncTaskExecutor());
        when(aggregator.buildView()).thenReturn(new AggregatedView(NOW, ZoneOffset.UTC, List.of(), ClusterStatus.OK));
    }

    private static RecipientPref pref(String id, Language lang) {
        return RecipientPref.builder().recipientId(id).language(lang).viewMode(ViewMode.COMPACT).build();
    }

    @Test
    @DisplayName("each recipient gets the digest in its own language in the same tick")
    void rendersPerRecipient() {
        when(prefs.getOrDefault("a")).thenReturn(pref("a", Language.EN));
        when(prefs.getOrDefault("b")).thenReturn(pref("b", Language.RU));

        var result = digests.runScheduled();

        assertThat(result.sent()).isEqualTo(2);
        verify(telegram).sendMessage(eq("a"), contains("Internet Speed Report"), any());
        verify(telegram).sendMessage(eq("b"), contains("Отчет о скорости интернета"), any());
        verify(aggregator, times(1)).buildView();
        assertThat(digests.lastDigestAt()).contains(NOW);
    }

    @Test
    @DisplayName("a failing recipient does not stop the others")
    void isolatesRecipientFailures() {
        when(prefs.getOrDefault("a")).thenReturn(pref("a", Language.EN));
        when(prefs.getOrDefault("b")).thenReturn(pref("b", Language.EN));
        when(telegram.sendMessage(eq("a"), anyString(), any()))
                .thenThrow(new TelegramApiException(403, "bot was blocked by the user", Map.of()));

        var result = digests.runScheduled();

        assertThat(result.sent()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        verify(telegram).sendMessage(eq("b"), anyString(), any());
    }

    @Test
    void reportTriggeredDigestRunsOnTheExecutor() {
        when(prefs.getOrDefault(anyString())).thenAnswer(inv -> pref(inv.getArgument(0), Language.EN));

        digests.dispatchAsync(DigestService.Trigger.REPORT);

        verify(telegram, times(2)).sendMessage(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("a tick that finds a digest in flight is skipped")
    void overlappingTickIsSkipped() throws Exception {
        when(prefs.getOrDefault(anyString())).thenAnswer(inv -> pref(inv.getArgument(0), Language.EN));
        var inFlight = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        doAnswer(inv -> {
            inFlight.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(1L);
        }).when(telegram).sendMessage(eq("a"), anyString(), any());

        var first = CompletableFuture.supplyAsync(digests::runScheduled);
        assertThat(inFlight.await(5, TimeUnit.SECONDS)).isTrue();

        var second = digests.runScheduled();
        release.countDown();

        assertThat(second.skipped()).isTrue();
        assertThat(first.get(5, TimeUnit.SECONDS).skipped()).isFalse();
        verify(aggregator, times(1)).buildView();
    }

    @Test
    void sendCurrentTargetsOneChatOnly() {
        when(prefs.getOrDefault("777")).thenReturn(pref("777", Language.EN));

        assertThat(digests.sendCurrent("777")).isTrue();

        verify(telegram).sendMessage(eq("777"), anyString(), any());
        verify(telegram, never()).sendMessage(eq("a"), anyString(), any());
    }
}
