package org.caureq.caureqspeedboard.service.digest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodic digest. The first tick waits one interval unless an initial delay is configured,
 * so nodes get a chance to report before anything is sent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledDigestJob {
    private final DigestService digests;

    @Scheduled(fixedRateString = "${app.schedule.interval-minutes:60}",
            initialDelayString = "${app.schedule.initial-delay-minutes:${app.schedule.interval-minutes:60}}",
            timeUnit = TimeUnit.MINUTES)
    public void tick() {
        try {
            digests.runScheduled();
        } catch (RuntimeException e) {
            log.error("[Digest] scheduled tick failed: {}", e.getMessage(), e);
        }
    }
}
