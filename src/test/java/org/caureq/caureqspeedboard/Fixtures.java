package org.caureq.caureqspeedboard;

import java.time.Instant;
import java.util.List;
import org.caureq.caureqspeedboard.config.AppProps;
import org.caureq.caureqspeedboard.domain.SpeedReport;

/** Shared builders for unit tests. */
public final class Fixtures {

    public static final String TOKEN = "test-token";

    private Fixtures() {}

    public static AppProps props(List<AppProps.NodeProps> nodes, List<AppProps.RecipientProps> recipients) {
        return props(nodes, recipients, false);
    }

    public static AppProps props(List<AppProps.NodeProps> nodes, List<AppProps.RecipientProps> recipients,
                                 boolean sendImmediately) {
        return new AppProps(TOKEN, "master", "UTC",
                new AppProps.StatusProps(120),
                new AppProps.ThresholdProps(50.0, 200.0, 500.0, 1000.0, 2000.0),
                new AppProps.ScheduleProps(60, null, sendImmediately),
                new AppProps.DefaultsProps("en", "compact"),
                nodes, recipients);
    }

    public static AppProps.NodeProps node(String id, String flag, String name) {
        return new AppProps.NodeProps(id, flag, name);
    }

    public static AppProps.RecipientProps recipient(String chatId, String lang, String view) {
        return new AppProps.RecipientProps(chatId, lang, view);
    }

    public static SpeedReport report(String nodeId, double down, Instant capturedAt) {
        return SpeedReport.builder()
                .nodeId(nodeId)
                .downloadMbps(down)
                .uploadMbps(down / 2)
                .pingMs(12.3)
                .capturedAt(capturedAt)
                .build();
    }
}
