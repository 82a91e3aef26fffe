package com.chicu.opsdash.live;

import com.chicu.opsdash.telemetry.model.TelemetryEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ограниченный буфер событий: новые сверху, без дублей по id.
 * Не потокобезопасен, живёт под монитором менеджера канала.
 */
public class EventBuffer {

    static final Comparator<TelemetryEvent> NEWEST_FIRST =
            Comparator.comparing(TelemetryEvent::getTimestamp).reversed()
                    .thenComparing(TelemetryEvent::getId);

    private final int capacity;
    private List<TelemetryEvent> items = new ArrayList<>();

    public EventBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    /**
     * Вливает пачку. Событие с уже известным id заменяет старую версию.
     *
     * @return true, если содержимое изменилось
     */
    public boolean merge(Collection<TelemetryEvent> incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return false;
        }
        Map<String, TelemetryEvent> byId = new LinkedHashMap<>();
        for (TelemetryEvent e : items) {
            byId.put(e.getId(), e);
        }
        for (TelemetryEvent e : incoming) {
            if (e != null && e.getId() != null && e.getTimestamp() != null) {
                byId.put(e.getId(), e);
            }
        }

        List<TelemetryEvent> merged = new ArrayList<>(byId.values());
        merged.sort(NEWEST_FIRST);
        if (merged.size() > capacity) {
            merged = new ArrayList<>(merged.subList(0, capacity));
        }

        boolean changed = !merged.equals(items);
        items = merged;
        return changed;
    }

    public List<TelemetryEvent> snapshot() {
        List<TelemetryEvent> out = new ArrayList<>(items.size());
        for (TelemetryEvent e : items) {
            out.add(e.copy());
        }
        return out;
    }

    public int size() {
        return items.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
