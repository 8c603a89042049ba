package org.caureq.caureqspeedboard.api;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqspeedboard.config.AppProps;
import org.caureq.caureqspeedboard.service.digest.DigestService;
import org.caureq.caureqspeedboard.service.prefs.RecipientDefaults;
import org.caureq.caureqspeedboard.service.state.NodeRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/** Liveness and mode only; report contents are never exposed here. */
@RestController
@RequiredArgsConstructor
public class HealthController {
    private final AppProps props;
    private final NodeRegistry registry;
    private final RecipientDefaults recipients;
    private final DigestService digests;
    private final Clock clock;

    @GetMapping("/health")
    public Map<String, Object> health() {
        var m = new LinkedHashMap<String, Object>();
        m.put("status", "UP");
        m.put("mode", props.mode());
        m.put("time", clock.instant());
        m.put("nodesConfigured", registry.configured().size());
        m.put("recipients", recipients.recipientIds().size());
        m.put("lastDigestAt", digests.lastDigestAt().orElse(null));
        return m;
    }
}
