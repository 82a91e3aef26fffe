package com.chicu.opsdash.regime;

import com.chicu.opsdash.telemetry.model.RegimeSegment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * История режимов рынка, новые сверху, не больше capacity сегментов.
 * Тот же режим подряд продлевает верхний сегмент, новый - кладётся сверху.
 */
@Slf4j
public class RegimeHistoryBuffer {

    private static final TypeReference<List<RegimeSegment>> LIST_TYPE = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final String key;
    private final int capacity;

    private final LinkedList<RegimeSegment> segments = new LinkedList<>();

    public RegimeHistoryBuffer(KeyValueStore store, ObjectMapper objectMapper, String key, int capacity) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.key = key;
        this.capacity = capacity > 0 ? capacity : 50;
        load();
    }

    private void load() {
        String raw = store.get(key).orElse(null);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            List<RegimeSegment> saved = objectMapper.readValue(raw, LIST_TYPE);
            saved.stream()
                    .filter(Objects::nonNull)
                    .limit(capacity)
                    .forEach(segments::add);
            log.info("🕰 regime history: восстановлено {} сегментов", segments.size());
        } catch (JsonProcessingException e) {
            log.warn("⚠ regime history повреждена, начинаю с пустой: {}", e.getOriginalMessage());
        }
    }

    /**
     * @param current текущий режим из источника
     * @param now     конец сегмента
     */
    public synchronized void record(RegimeSegment current, Instant now) {
        if (current == null || current.getLabel() == null) {
            return;
        }

        RegimeSegment head = segments.peekFirst();
        if (head != null && current.getLabel().equals(head.getLabel())) {
            head.setEnd(now);
            if (current.getConfidence() != null) {
                head.setConfidence(current.getConfidence());
            }
        } else {
            RegimeSegment seg = current.toBuilder()
                    .start(current.getStart() != null ? current.getStart() : now)
                    .end(now)
                    .events(new ArrayList<>(current.getEvents() != null ? current.getEvents() : List.of()))
                    .build();
            segments.addFirst(seg);
            log.info("🕰 regime: новый сегмент '{}'", seg.getLabel());
        }

        while (segments.size() > capacity) {
            segments.removeLast();
        }
        persist();
    }

    private void persist() {
        try {
            store.put(key, objectMapper.writeValueAsString(segments));
        } catch (JsonProcessingException | UncheckedIOException e) {
            // история остаётся в памяти
            log.warn("⚠ regime history не сохранена: {}", e.getMessage());
        }
    }

    public synchronized List<RegimeSegment> segments() {
        List<RegimeSegment> out = new ArrayList<>(segments.size());
        for (RegimeSegment s : segments) {
            out.add(s.toBuilder()
                    .events(s.getEvents() != null ? new ArrayList<>(s.getEvents()) : new ArrayList<>())
                    .build());
        }
        return out;
    }

    public synchronized int size() {
        return segments.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
