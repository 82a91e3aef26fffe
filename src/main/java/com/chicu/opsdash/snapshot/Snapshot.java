package com.chicu.opsdash.snapshot;

import java.time.Instant;

/**
 * Последний ответ панели.
 * stale = последняя выборка не удалась, payload от предыдущей успешной (или null).
 */
public record Snapshot(String name, Object payload, Instant fetchedAt, boolean stale) {
}
