package com.chicu.opsdash.common.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Явный диапазон времени [from, to], границы включительно.
 * Приходит из выбора режима на таймлайне или из query-параметров.
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("TimeRange: to < from (" + from + " .. " + to + ")");
        }
    }

    public static TimeRange ofEpochMillis(long fromMs, long toMs) {
        return new TimeRange(Instant.ofEpochMilli(fromMs), Instant.ofEpochMilli(toMs));
    }

    public boolean contains(Instant ts) {
        return ts != null && !ts.isBefore(from) && !ts.isAfter(to);
    }
}
