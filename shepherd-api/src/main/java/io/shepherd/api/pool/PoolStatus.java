package io.shepherd.api.pool;

import java.time.Instant;

/**
 * Snapshot of a registered pool at a point in time.
 * Used by external observers (status pages, health checks) that cannot go through
 * the command queue.
 */
public record PoolStatus(
        String name,
        PoolType type,
        Instant startedAt,
        boolean cancelled
) {}
