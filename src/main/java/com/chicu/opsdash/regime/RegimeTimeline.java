package com.chicu.opsdash.regime;

import com.chicu.opsdash.telemetry.model.RegimeSegment;

import java.time.Instant;
import java.util.List;

/**
 * Сегменты для ленты режимов и видимый диапазон [from, to] по всем сегментам.
 * Пустая история → from/to = null.
 */
public record RegimeTimeline(List<RegimeSegment> segments, Instant from, Instant to) {
}
