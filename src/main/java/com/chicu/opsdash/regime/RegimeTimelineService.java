package com.chicu.opsdash.regime;

import com.chicu.opsdash.common.time.TimeRange;
import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.telemetry.model.RegimeSegment;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Лента режимов рынка: опрос текущего режима → история → цвета.
 * Выбранный сегмент отдаёт свой диапазон в heatmap.
 */
@Slf4j
public class RegimeTimelineService {

    static final List<String> PALETTE = List.of(
            "#1d4ed8",
            "#0f766e",
            "#9333ea",
            "#b45309",
            "#be123c",
            "#0ea5e9",
            "#059669",
            "#7c3aed"
    );

    private final SourceAdapter<RegimeSegment> source;
    private final RegimeHistoryBuffer history;
    private final Clock clock;

    public RegimeTimelineService(SourceAdapter<RegimeSegment> source, RegimeHistoryBuffer history, Clock clock) {
        this.source = source;
        this.history = history;
        this.clock = clock;
    }

    public RegimeTimeline refresh() {
        Optional<RegimeSegment> current = source.fetchSingle(Map.of());
        if (current.isPresent()) {
            history.record(current.get(), clock.instant());
        } else {
            log.debug("regime: текущий режим недоступен, история без изменений");
        }
        return timeline();
    }

    /** Цвет из палитры по позиции для сегментов, у которых его нет */
    public RegimeTimeline timeline() {
        List<RegimeSegment> segments = history.segments();
        Instant from = null;
        Instant to = null;

        for (int i = 0; i < segments.size(); i++) {
            RegimeSegment s = segments.get(i);
            if (s.getColor() == null || s.getColor().isBlank()) {
                s.setColor(PALETTE.get(i % PALETTE.size()));
            }
            if (s.getStart() != null && (from == null || s.getStart().isBefore(from))) from = s.getStart();
            if (s.getEnd() != null && (to == null || s.getEnd().isAfter(to))) to = s.getEnd();
        }
        return new RegimeTimeline(segments, from, to);
    }

    /**
     * @throws NoSuchElementException нет сегмента с таким id
     */
    public TimeRange select(String id) {
        RegimeSegment seg = history.segments().stream()
                .filter(s -> id != null && id.equals(s.getId()))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("Regime segment not found: " + id));

        Instant start = seg.getStart();
        Instant end = seg.getEnd() != null ? seg.getEnd() : start;
        if (end.isBefore(start)) {
            // кривой start из источника
            return new TimeRange(end, start);
        }
        return new TimeRange(start, end);
    }
}
