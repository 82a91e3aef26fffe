package com.chicu.opsdash.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Планировщик периодических обновлений по строковому ключу.
 *
 * Только крутит задачи по таймеру: первый запуск сразу, дальше каждые interval.
 * Про источники и панели ничего не знает.
 */
public interface RefreshScheduler {

    /**
     * Запускает периодическую задачу. Существующая задача с тем же ключом снимается.
     *
     * @param key      уникальный ключ (например: "alert-feed")
     * @param task     логика одного цикла
     * @param interval период, > 0
     */
    RefreshHandle activate(String key, RefreshTask task, Duration interval);

    default RefreshHandle activate(String key, Runnable task, Duration interval) {
        return activate(key, handle -> task.run(), interval);
    }

    /**
     * Остановка по ключу. Повторный вызов - no-op.
     */
    void deactivate(String key);

    boolean isActive(String key);

    Optional<Instant> getStartedAt(String key);

    void deactivateAll();
}
