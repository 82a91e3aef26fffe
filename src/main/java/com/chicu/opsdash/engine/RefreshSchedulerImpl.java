package com.chicu.opsdash.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class RefreshSchedulerImpl implements RefreshScheduler {

    private final ScheduledExecutorService executor;
    private final Clock clock;

    /** key → handle задачи */
    private final Map<String, RefreshHandle> tasks = new ConcurrentHashMap<>();

    public RefreshSchedulerImpl(@Qualifier("opsScheduler") ScheduledExecutorService executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    // ==============================================================
    // ▶️ START TASK
    // ==============================================================
    @Override
    public RefreshHandle activate(String key, RefreshTask task, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }

        // если задача существует - снимаем перед созданием новой
        deactivate(key);

        RefreshHandle handle = new RefreshHandle(key, clock.instant());
        tasks.put(key, handle);

        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                () -> runCycle(handle, task),
                0,                   // старт немедленно
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        handle.attach(future);

        log.info("⏱ Refresh: started '{}' (interval={}s)", key, interval.toSeconds());
        return handle;
    }

    /**
     * Исключение из scheduleAtFixedRate молча останавливает повторы,
     * поэтому цикл ловит всё сам.
     */
    private void runCycle(RefreshHandle handle, RefreshTask task) {
        if (!handle.isAlive()) {
            return;
        }
        try {
            task.run(handle);
        } catch (Exception e) {
            log.error("❌ Refresh '{}' cycle failed: {}", handle.getKey(), e.getMessage(), e);
        }
    }

    // ==============================================================
    // ⏹ DEACTIVATE
    // ==============================================================
    @Override
    public void deactivate(String key) {
        RefreshHandle handle = tasks.remove(key);

        if (handle != null) {
            handle.kill();
            log.info("🛑 Refresh: deactivated '{}'", key);
        }
    }

    @Override
    public void deactivateAll() {
        for (String key : List.copyOf(tasks.keySet())) {
            deactivate(key);
        }
    }

    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    @Override
    public boolean isActive(String key) {
        RefreshHandle handle = tasks.get(key);
        return handle != null && handle.isAlive();
    }

    @Override
    public Optional<Instant> getStartedAt(String key) {
        return Optional.ofNullable(tasks.get(key)).map(RefreshHandle::getStartedAt);
    }

    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        if (log.isInfoEnabled()) {
            log.info("💤 RefreshScheduler shutting down…");
        }
        deactivateAll();
    }
}
