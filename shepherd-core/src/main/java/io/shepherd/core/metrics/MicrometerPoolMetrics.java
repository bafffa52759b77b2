package io.shepherd.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.shepherd.api.metrics.PoolMetrics;
import io.shepherd.api.pool.PoolType;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default pool metrics using Micrometer.
 * Tracks pool lifecycle at the manager level and job outcomes per pool and job type.
 */
public class MicrometerPoolMetrics implements PoolMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activePools = new AtomicInteger(0);

    public MicrometerPoolMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerPoolMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("shepherd.pools.active", activePools, AtomicInteger::get)
                .description("Pools currently registered with the manager")
                .register(registry);
    }

    @Override
    public void recordPoolStarted(String poolName, PoolType type) {
        Counter.builder("shepherd.pools.started")
                .tag("pool", poolName)
                .tag("type", type.value())
                .register(registry)
                .increment();
    }

    @Override
    public void recordPoolStopped(String poolName) {
        Counter.builder("shepherd.pools.stopped")
                .tag("pool", poolName)
                .register(registry)
                .increment();
    }

    @Override
    public void recordCommandIgnored(String reason) {
        Counter.builder("shepherd.commands.ignored")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    @Override
    public void recordActivePools(int count) {
        activePools.set(count);
    }

    @Override
    public void recordJobCompleted(String poolName, String jobType, Duration duration) {
        jobTimer(poolName, jobType).record(duration);
        jobCounter("shepherd.jobs.completed", poolName, jobType).increment();
    }

    @Override
    public void recordJobFailed(String poolName, String jobType, Duration duration, Throwable error) {
        jobTimer(poolName, jobType).record(duration);
        jobCounter("shepherd.jobs.failed", poolName, jobType).increment();
    }

    @Override
    public void recordJobRetried(String poolName, String jobType) {
        jobCounter("shepherd.jobs.retried", poolName, jobType).increment();
    }

    @Override
    public void recordJobDeadLettered(String poolName, String jobType) {
        jobCounter("shepherd.jobs.dead_lettered", poolName, jobType).increment();
    }

    // Micrometer returns the existing meter when name and tags match
    private Counter jobCounter(String name, String poolName, String jobType) {
        return Counter.builder(name)
                .tag("pool", poolName)
                .tag("type", jobType)
                .register(registry);
    }

    private Timer jobTimer(String poolName, String jobType) {
        return Timer.builder("shepherd.jobs.duration")
                .tag("pool", poolName)
                .tag("type", jobType)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }
}
