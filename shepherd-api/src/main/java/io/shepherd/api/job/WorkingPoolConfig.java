package io.shepherd.api.job;

import java.time.Duration;

/**
 * Configuration for a queue-consuming working pool.
 */
public final class WorkingPoolConfig {

    private String queueNameBase = "queue:general";
    private int numWorkers = 4;
    private Duration jobTimeout = Duration.ofMinutes(5);
    private Duration pollTimeout = Duration.ofSeconds(5);
    private double callsPerSecond = 0; // 0 = no rate limit
    private int burst = 1;
    private long dailyQuota = 0; // 0 = unlimited
    private Duration quotaBackoff = Duration.ofHours(1);

    private WorkingPoolConfig() {}

    public static WorkingPoolConfig create() {
        return new WorkingPoolConfig();
    }

    /**
     * Base name of the queues, e.g. {@code queue:general}. The pool uses
     * {@code <base>:pending}, {@code <base>:running} and {@code <base>:dlq}.
     */
    public WorkingPoolConfig queueNameBase(String queueNameBase) {
        if (queueNameBase == null || queueNameBase.isBlank()) {
            throw new IllegalArgumentException("Queue name base must not be blank");
        }
        this.queueNameBase = queueNameBase;
        return this;
    }

    public WorkingPoolConfig numWorkers(int numWorkers) {
        if (numWorkers <= 0) {
            throw new IllegalArgumentException("Number of workers must be positive");
        }
        this.numWorkers = numWorkers;
        return this;
    }

    public WorkingPoolConfig jobTimeout(Duration jobTimeout) {
        requirePositive(jobTimeout, "Job timeout");
        this.jobTimeout = jobTimeout;
        return this;
    }

    /**
     * How long a worker waits for a pending job before re-checking for cancellation.
     */
    public WorkingPoolConfig pollTimeout(Duration pollTimeout) {
        requirePositive(pollTimeout, "Poll timeout");
        this.pollTimeout = pollTimeout;
        return this;
    }

    public WorkingPoolConfig rateLimit(double callsPerSecond, int burst) {
        if (callsPerSecond < 0) {
            throw new IllegalArgumentException("Calls per second must not be negative");
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("Burst must be positive");
        }
        this.callsPerSecond = callsPerSecond;
        this.burst = burst;
        return this;
    }

    public WorkingPoolConfig dailyQuota(long dailyQuota) {
        if (dailyQuota < 0) {
            throw new IllegalArgumentException("Daily quota must not be negative");
        }
        this.dailyQuota = dailyQuota;
        return this;
    }

    /**
     * How long a worker sleeps after hitting the daily quota.
     */
    public WorkingPoolConfig quotaBackoff(Duration quotaBackoff) {
        requirePositive(quotaBackoff, "Quota backoff");
        this.quotaBackoff = quotaBackoff;
        return this;
    }

    public String queueNameBase() { return queueNameBase; }
    public String pendingQueueName() { return queueNameBase + ":pending"; }
    public String runningQueueName() { return queueNameBase + ":running"; }
    public String deadLetterQueueName() { return queueNameBase + ":dlq"; }
    public int numWorkers() { return numWorkers; }
    public Duration jobTimeout() { return jobTimeout; }
    public Duration pollTimeout() { return pollTimeout; }
    public double callsPerSecond() { return callsPerSecond; }
    public int burst() { return burst; }
    public boolean rateLimited() { return callsPerSecond > 0; }
    public long dailyQuota() { return dailyQuota; }
    public Duration quotaBackoff() { return quotaBackoff; }

    private static void requirePositive(Duration value, String what) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(what + " must be positive");
        }
    }
}
