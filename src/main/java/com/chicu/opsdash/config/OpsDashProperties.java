package com.chicu.opsdash.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "opsdash")
public class OpsDashProperties {

    private Upstream upstream = new Upstream();
    private Sources sources = new Sources();
    private WriteBack writeBack = new WriteBack();
    private Live live = new Live();
    private Feed feed = new Feed();
    private Fusion fusion = new Fusion();
    private Refresh refresh = new Refresh();
    private Regime regime = new Regime();

    /** Pass-through панели: имя → пути + период */
    private Map<String, Snapshot> snapshots = defaultSnapshots();

    @Data
    public static class Upstream {
        /**
         * Пример: http://127.0.0.1:8080
         */
        private String baseUrl = "http://127.0.0.1:8080";

        /** X-API-Key для admin/system ручек, пусто = не слать */
        private String apiKey = "";

        private long connectTimeoutMs = 3000;
        private long readTimeoutMs = 12000;
        private int maxConnections = 50;
    }

    /**
     * Пути-кандидаты по логическим источникам.
     * Порядок = приоритет, побеждает первый ответивший.
     */
    @Data
    public static class Sources {
        private List<String> alerts = new ArrayList<>(List.of("/api/alerts"));
        private List<String> notifications = new ArrayList<>(List.of("/api/notifications"));
        private List<String> compliance = new ArrayList<>(List.of("/api/compliance/logs"));
        private List<String> audit = new ArrayList<>(List.of("/api/system/audit"));
        private List<String> anomalies = new ArrayList<>(List.of("/api/data/anomalies"));

        private List<String> latency = new ArrayList<>(List.of(
                "/api/execution/latency",
                "/execution/latency"
        ));

        // impact несколько раз переезжал
        private List<String> impact = new ArrayList<>(List.of(
                "/api/execution/logs/realized",
                "/api/execution/impact",
                "/api/execution/realized-impact",
                "/execution/logs/realized",
                "/execution/impact"
        ));

        private List<String> venueHealth = new ArrayList<>(List.of("/api/venue/health"));

        private List<String> regime = new ArrayList<>(List.of(
                "/api/strategies/regime/current",
                "/api/v1/strategies/regime/current"
        ));
    }

    @Data
    public static class WriteBack {
        private String notificationReadPath = "/api/notifications/{id}/read";
        private String notificationsReadAllPath = "/api/notifications/mark-all-read";
        private String anomalyAckPath = "/api/data/anomalies/{id}/ack";
    }

    @Data
    public static class Live {
        /** поднимать каналы при старте приложения */
        private boolean autostart = true;

        private String streamPath = "/api/v1/events/alerts/stream";
        private List<String> pollPaths = new ArrayList<>(List.of(
                "/api/v1/events/alerts",
                "/api/events/alerts"
        ));

        private Duration pollInterval = Duration.ofSeconds(3);
        private int pollLimit = 50;

        /**
         * Повторная попытка SSE из режима polling.
         * 0 = не возвращаться в streaming.
         */
        private Duration streamRetryInterval = Duration.ZERO;

        private Map<String, LiveFeed> feeds = defaultFeeds();
    }

    @Data
    public static class LiveFeed {
        private int capacity = 200;

        /** значение поля event, пусто = все события */
        private String eventFilter = "";
    }

    @Data
    public static class Feed {
        private int capacity = 50;
    }

    @Data
    public static class Fusion {
        private double discrepancyThreshold = 0.25;
        private String defaultWindow = "1h";
    }

    @Data
    public static class Refresh {
        /** выключается в тестах, чтобы контекст не ходил в апстрим */
        private boolean enabled = true;

        private Duration alertFeed = Duration.ofSeconds(15);
        private Duration heatmap = Duration.ofSeconds(30);
        private Duration regime = Duration.ofSeconds(30);
        private boolean heatmapAutoRefresh = true;

        private int ioThreads = 8;
    }

    @Data
    public static class Regime {
        private int capacity = 50;

        /** memory | file */
        private String store = "memory";
        private String file = "./opsdash-data/kv-store.json";
        private String historyKey = "regime_history_buffer";
    }

    @Data
    public static class Snapshot {
        private List<String> paths = new ArrayList<>();
        private Duration interval = Duration.ofSeconds(30);
    }

    private static Map<String, LiveFeed> defaultFeeds() {
        Map<String, LiveFeed> m = new LinkedHashMap<>();

        LiveFeed breaches = new LiveFeed();
        breaches.setCapacity(200);
        breaches.setEventFilter("live_metrics_breach");
        m.put("breaches", breaches);

        LiveFeed alerts = new LiveFeed();
        alerts.setCapacity(200);
        m.put("alerts", alerts);

        return m;
    }

    private static Map<String, Snapshot> defaultSnapshots() {
        Map<String, Snapshot> m = new LinkedHashMap<>();
        m.put("risk-metrics", snapshot(Duration.ofSeconds(5), "/api/risk/live-metrics", "/api/v1/risk/live-metrics"));
        m.put("training-jobs", snapshot(Duration.ofSeconds(10), "/api/models/jobs", "/api/v1/models/history"));
        m.put("datasets", snapshot(Duration.ofSeconds(30), "/api/data/datasets"));
        m.put("models", snapshot(Duration.ofSeconds(30), "/api/models", "/api/v1/models"));
        return m;
    }

    private static Snapshot snapshot(Duration interval, String... paths) {
        Snapshot s = new Snapshot();
        s.setInterval(interval);
        s.setPaths(new ArrayList<>(List.of(paths)));
        return s;
    }
}
