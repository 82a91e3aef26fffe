package com.chicu.opsdash.snapshot;

import com.chicu.opsdash.engine.RefreshScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Pass-through панели: данные не сверяются, только перекладываются с периодом.
 * Ошибка выборки не затирает прошлый payload, а помечает его stale.
 */
@Slf4j
public class SnapshotService {

    public static final String KEY_PREFIX = "snapshot:";

    private record Feed(Supplier<Optional<?>> loader, Duration interval) {
    }

    private final Clock clock;
    private final Map<String, Feed> feeds = new LinkedHashMap<>();
    private final Map<String, Snapshot> latest = new ConcurrentHashMap<>();

    public SnapshotService(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param loader пусто = источник не ответил
     */
    public synchronized void register(String name, Duration interval, Supplier<Optional<?>> loader) {
        feeds.put(name, new Feed(loader, interval));
        latest.put(name, new Snapshot(name, null, null, true));
    }

    public Snapshot refresh(String name) {
        Feed feed;
        synchronized (this) {
            feed = feeds.get(name);
        }
        if (feed == null) {
            throw new NoSuchElementException("Unknown snapshot: " + name);
        }

        Optional<?> payload;
        try {
            payload = feed.loader().get();
        } catch (RuntimeException e) {
            log.warn("⚠ snapshot '{}' failed: {}", name, e.getMessage());
            payload = Optional.empty();
        }

        Snapshot next = payload.isPresent()
                ? new Snapshot(name, payload.get(), clock.instant(), false)
                : markStale(latest.get(name), name);
        latest.put(name, next);
        return next;
    }

    private static Snapshot markStale(Snapshot prev, String name) {
        if (prev == null) {
            return new Snapshot(name, null, null, true);
        }
        return new Snapshot(name, prev.payload(), prev.fetchedAt(), true);
    }

    public Snapshot get(String name) {
        Snapshot s = latest.get(name);
        if (s == null) {
            throw new NoSuchElementException("Unknown snapshot: " + name);
        }
        return s;
    }

    public synchronized List<Snapshot> all() {
        List<Snapshot> out = new ArrayList<>(feeds.size());
        for (String name : feeds.keySet()) {
            out.add(latest.get(name));
        }
        return out;
    }

    public synchronized List<String> names() {
        return List.copyOf(feeds.keySet());
    }

    /** Каждая панель - своя задача в планировщике, со своим периодом */
    public void activateAll(RefreshScheduler scheduler) {
        Map<String, Duration> copy = new LinkedHashMap<>();
        synchronized (this) {
            feeds.forEach((name, feed) -> copy.put(name, feed.interval()));
        }
        copy.forEach((name, interval) -> scheduler.activate(KEY_PREFIX + name, () -> refresh(name), interval));
    }

    public void deactivateAll(RefreshScheduler scheduler) {
        for (String name : names()) {
            scheduler.deactivate(KEY_PREFIX + name);
        }
    }
}
