package com.chicu.opsdash.common.enums;

import java.time.Duration;

/** Стандартные периоды обновления панелей */
public enum RefreshCadence {
    RISK_METRICS(Duration.ofSeconds(5)),
    TRAINING_JOBS(Duration.ofSeconds(10)),
    ALERT_FEED(Duration.ofSeconds(15)),
    REGISTRIES(Duration.ofSeconds(30)),
    EXECUTION_HEATMAP(Duration.ofSeconds(30));

    private final Duration interval;

    RefreshCadence(Duration interval) {
        this.interval = interval;
    }

    public Duration getInterval() {
        return interval;
    }
}
