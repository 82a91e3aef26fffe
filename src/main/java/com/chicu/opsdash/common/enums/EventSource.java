package com.chicu.opsdash.common.enums;

import java.util.Locale;

/** Адаптер-источник, из которого пришло событие */
public enum EventSource {
    ALERTS,
    NOTIFICATIONS,
    COMPLIANCE,
    AUDIT,
    ANOMALIES;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Источники, у которых есть серверное состояние read/ack */
    public boolean supportsWriteBack() {
        return this == NOTIFICATIONS || this == ANOMALIES;
    }
}
