package com.chicu.opsdash.engine;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Живая регистрация задачи в планировщике.
 * После deactivate() isAlive() = false, и уже летящий цикл не применяет свой результат.
 */
public class RefreshHandle {

    private final String key;
    private final Instant startedAt;
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private volatile ScheduledFuture<?> future;

    RefreshHandle(String key, Instant startedAt) {
        this.key = key;
        this.startedAt = startedAt;
    }

    public String getKey() {
        return key;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public boolean isAlive() {
        return alive.get();
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    void kill() {
        alive.set(false);
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }
}
