package com.chicu.opsdash.common.time;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Именованное окно для execution heatmap с поддержкой alias-строк.
 * Парсинг через словарь, как у таймфреймов.
 */
public enum TimeWindow {
    M15(Duration.ofMinutes(15), "15m"),
    H1(Duration.ofHours(1), "1h"),
    H4(Duration.ofHours(4), "4h"),
    H24(Duration.ofHours(24), "24h");

    private final Duration length;
    private final String code;

    TimeWindow(Duration length, String code) {
        this.length = length;
        this.code = code;
    }

    public Duration getLength() {
        return length;
    }

    /** Код, который уходит в query-параметр window */
    public String getCode() {
        return code;
    }

    // ---------- Разбор строк ----------

    private static final Map<String, TimeWindow> LOOKUP;

    static {
        Map<String, TimeWindow> m = new HashMap<>();

        putAll(m, M15, "15m", "15min", "15 minutes", "15-minute", "900", "900s");
        putAll(m, H1,  "1h", "01h", "1hr", "1 hour", "1-hour", "60m", "3600", "3600s");
        putAll(m, H4,  "4h", "04h", "4hr", "4 hours", "4-hour", "240m");
        putAll(m, H24, "24h", "24hr", "24 hours", "24-hour", "1d", "1 day", "1-day");

        LOOKUP = Collections.unmodifiableMap(m);
    }

    private static String norm(String s) {
        return s == null ? null : s.trim().toLowerCase(Locale.ROOT).replace(" ", "");
    }

    private static void putAll(Map<String, TimeWindow> m, TimeWindow w, String... keys) {
        for (String k : keys) {
            String n = norm(k);
            if (n != null && !n.isEmpty()) {
                m.put(n, w);
            }
        }
        m.put(norm(w.code), w);
    }

    /**
     * Разбор окна с алиасами.
     * Если не распознано - H1, как дефолт панели.
     */
    public static TimeWindow from(String s) {
        if (s == null || s.isBlank()) {
            return H1;
        }
        TimeWindow w = LOOKUP.get(norm(s));
        return w != null ? w : H1;
    }
}
