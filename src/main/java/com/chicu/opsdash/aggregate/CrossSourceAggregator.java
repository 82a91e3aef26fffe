package com.chicu.opsdash.aggregate;

import com.chicu.opsdash.common.enums.EventSource;
import com.chicu.opsdash.source.SourceAdapter;
import com.chicu.opsdash.telemetry.model.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 🔔 Единая лента событий из пяти источников.
 *
 * refresh(): все адаптеры параллельно → склейка → сортировка (новые сверху)
 * → дедуп по source:id → обрезка → повторное наложение локальных read/ack/dismiss.
 *
 * Локальные действия применяются сразу, запись в источник - best-effort,
 * без отката при ошибке.
 */
@Slf4j
public class CrossSourceAggregator {

    /** timestamp desc, затем порядок источника, затем id */
    static final Comparator<TelemetryEvent> FEED_ORDER =
            Comparator.comparing(TelemetryEvent::getTimestamp).reversed()
                    .thenComparing(e -> e.getSource() != null ? e.getSource().ordinal() : Integer.MAX_VALUE)
                    .thenComparing(TelemetryEvent::getId);

    private final List<SourceAdapter<TelemetryEvent>> adapters;
    private final WriteBackClient writeBack;
    private final Executor ioExecutor;
    private final Executor writeBackExecutor;
    private final int capacity;
    private final Clock clock;

    private final List<Consumer<List<TelemetryEvent>>> listeners = new CopyOnWriteArrayList<>();

    // ---- состояние под this ----
    private List<TelemetryEvent> feed = List.of();
    private Instant refreshedAt;
    private final Set<String> readKeys = new HashSet<>();
    private final Set<String> ackKeys = new HashSet<>();
    private final Set<String> dismissedKeys = new HashSet<>();

    public CrossSourceAggregator(List<SourceAdapter<TelemetryEvent>> adapters,
                                 WriteBackClient writeBack,
                                 Executor ioExecutor,
                                 Executor writeBackExecutor,
                                 int capacity,
                                 Clock clock) {
        this.adapters = List.copyOf(adapters);
        this.writeBack = writeBack;
        this.ioExecutor = ioExecutor;
        this.writeBackExecutor = writeBackExecutor;
        this.capacity = capacity > 0 ? capacity : 50;
        this.clock = clock;
    }

    public void addListener(Consumer<List<TelemetryEvent>> listener) {
        listeners.add(listener);
    }

    // =====================================================================
    // 🔄 REFRESH
    // =====================================================================

    public List<TelemetryEvent> refresh() {
        return refresh(() -> true);
    }

    /**
     * @param alive проверяется перед заменой ленты; false → результат цикла выбрасывается
     */
    public List<TelemetryEvent> refresh(BooleanSupplier alive) {
        List<CompletableFuture<List<TelemetryEvent>>> futures = new ArrayList<>(adapters.size());
        for (SourceAdapter<TelemetryEvent> adapter : adapters) {
            futures.add(CompletableFuture
                    .supplyAsync(adapter::fetch, ioExecutor)
                    .exceptionally(ex -> {
                        log.warn("⚠ feed: источник '{}' упал: {}", adapter.getName(), ex.getMessage());
                        return List.of();
                    }));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<TelemetryEvent> all = new ArrayList<>();
        for (CompletableFuture<List<TelemetryEvent>> f : futures) {
            all.addAll(f.join());
        }

        List<TelemetryEvent> snapshot;
        synchronized (this) {
            if (!alive.getAsBoolean()) {
                log.debug("feed: цикл отменён, результат отброшен");
                return feedCopy();
            }
            feed = reconcile(all);
            refreshedAt = clock.instant();
            snapshot = feedCopy();
        }

        log.info("🔔 feed refreshed: {} fetched → {} items", all.size(), snapshot.size());
        publish(snapshot);
        return snapshot;
    }

    /** Под this. */
    private List<TelemetryEvent> reconcile(List<TelemetryEvent> fetched) {
        List<TelemetryEvent> sorted = new ArrayList<>(fetched);
        sorted.removeIf(e -> e == null || e.getId() == null || e.getTimestamp() == null);
        sorted.sort(FEED_ORDER);

        Map<String, TelemetryEvent> unique = new LinkedHashMap<>();
        for (TelemetryEvent e : sorted) {
            unique.putIfAbsent(e.getKey(), e);
        }

        // overrides для исчезнувших из источников id больше не нужны
        readKeys.retainAll(unique.keySet());
        ackKeys.retainAll(unique.keySet());
        dismissedKeys.retainAll(unique.keySet());

        List<TelemetryEvent> out = new ArrayList<>(Math.min(capacity, unique.size()));
        for (TelemetryEvent e : unique.values()) {
            if (out.size() >= capacity) break;
            TelemetryEvent copy = e.copy();
            if (dismissedKeys.contains(copy.getKey())) continue;
            if (readKeys.contains(copy.getKey())) copy.setRead(true);
            if (ackKeys.contains(copy.getKey())) {
                copy.setAcknowledged(true);
                copy.setRead(true);
            }
            out.add(copy);
        }
        return List.copyOf(out);
    }

    // =====================================================================
    // ✋ ACTIONS
    // =====================================================================

    /**
     * @param key ключ события в ленте (source:id)
     */
    public void markRead(String key) {
        TelemetryEvent ev;
        synchronized (this) {
            ev = require(key);
            readKeys.add(key);
            ev.setRead(true);
        }
        if (ev.getSource() == EventSource.NOTIFICATIONS) {
            String id = ev.getId();
            writeBackAsync(() -> writeBack.markNotificationRead(id));
        }
        publish(feed());
    }

    public void markAllRead() {
        synchronized (this) {
            for (TelemetryEvent e : feed) {
                readKeys.add(e.getKey());
                e.setRead(true);
            }
        }
        writeBackAsync(writeBack::markAllNotificationsRead);
        publish(feed());
    }

    /** ack аномалии, заодно read */
    public void acknowledge(String key) {
        TelemetryEvent ev;
        synchronized (this) {
            ev = require(key);
            ackKeys.add(key);
            readKeys.add(key);
            ev.setAcknowledged(true);
            ev.setRead(true);
        }
        if (ev.getSource() == EventSource.ANOMALIES) {
            String id = ev.getId();
            writeBackAsync(() -> writeBack.acknowledgeAnomaly(id));
        }
        publish(feed());
    }

    public void dismiss(String key) {
        TelemetryEvent ev;
        synchronized (this) {
            ev = require(key);
            dismissedKeys.add(key);
            List<TelemetryEvent> next = new ArrayList<>(feed);
            next.removeIf(e -> e.getKey().equals(key));
            feed = List.copyOf(next);
        }
        if (ev.getSource() == EventSource.NOTIFICATIONS && !ev.isRead()) {
            String id = ev.getId();
            writeBackAsync(() -> writeBack.markNotificationRead(id));
        }
        publish(feed());
    }

    // =====================================================================
    // READ
    // =====================================================================

    public synchronized List<TelemetryEvent> feed() {
        return feedCopy();
    }

    public synchronized long unreadCount() {
        return feed.stream().filter(e -> !e.isRead()).count();
    }

    public synchronized AlertFeedSnapshot snapshot() {
        return new AlertFeedSnapshot(feedCopy(), unreadCount(), refreshedAt);
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private TelemetryEvent require(String key) {
        for (TelemetryEvent e : feed) {
            if (e.getKey().equals(key)) {
                return e;
            }
        }
        throw new NoSuchElementException("Event not found: " + key);
    }

    private List<TelemetryEvent> feedCopy() {
        List<TelemetryEvent> out = new ArrayList<>(feed.size());
        for (TelemetryEvent e : feed) {
            out.add(e.copy());
        }
        return out;
    }

    private void writeBackAsync(Runnable call) {
        try {
            writeBackExecutor.execute(call);
        } catch (RuntimeException e) {
            log.warn("⚠ write-back не запланирован: {}", e.getMessage());
        }
    }

    private void publish(List<TelemetryEvent> snapshot) {
        for (Consumer<List<TelemetryEvent>> l : listeners) {
            try {
                l.accept(snapshot);
            } catch (RuntimeException e) {
                log.warn("⚠ feed listener failed: {}", e.getMessage());
            }
        }
    }
}
