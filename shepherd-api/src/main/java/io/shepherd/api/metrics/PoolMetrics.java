package io.shepherd.api.metrics;

import io.shepherd.api.pool.PoolType;

import java.time.Duration;

/**
 * Abstraction for pool and job metrics.
 * Default implementation uses Micrometer.
 */
public interface PoolMetrics {

    void recordPoolStarted(String poolName, PoolType type);

    void recordPoolStopped(String poolName);

    /**
     * Record a command the control loop ignored.
     *
     * @param reason short tag, e.g. {@code duplicate} or {@code unknown}
     */
    void recordCommandIgnored(String reason);

    void recordActivePools(int count);

    void recordJobCompleted(String poolName, String jobType, Duration duration);

    void recordJobFailed(String poolName, String jobType, Duration duration, Throwable error);

    void recordJobRetried(String poolName, String jobType);

    void recordJobDeadLettered(String poolName, String jobType);
}
