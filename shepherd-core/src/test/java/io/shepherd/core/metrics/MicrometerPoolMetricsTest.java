package io.shepherd.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.shepherd.api.pool.PoolType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerPoolMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerPoolMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerPoolMetrics(registry);
    }

    @Test
    void shouldCountPoolLifecycle() {
        metrics.recordPoolStarted("A", PoolType.WORKING);
        metrics.recordPoolStarted("A", PoolType.WORKING);
        metrics.recordPoolStopped("A");
        metrics.recordActivePools(3);

        assertThat(registry.get("shepherd.pools.started").tag("pool", "A").tag("type", "working").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("shepherd.pools.stopped").tag("pool", "A").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("shepherd.pools.active").gauge().value()).isEqualTo(3.0);
    }

    @Test
    void shouldTagIgnoredCommandsByReason() {
        metrics.recordCommandIgnored("duplicate");
        metrics.recordCommandIgnored("unknown");
        metrics.recordCommandIgnored("unknown");

        assertThat(registry.get("shepherd.commands.ignored").tag("reason", "unknown").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldRecordJobOutcomesPerType() {
        metrics.recordJobCompleted("daily", "fetch", Duration.ofMillis(40));
        metrics.recordJobFailed("daily", "fetch", Duration.ofMillis(60), new IllegalStateException("x"));
        metrics.recordJobRetried("daily", "fetch");
        metrics.recordJobDeadLettered("daily", "fetch");

        assertThat(registry.get("shepherd.jobs.duration").tag("type", "fetch").timer().count()).isEqualTo(2);
        assertThat(registry.get("shepherd.jobs.completed").tag("pool", "daily").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("shepherd.jobs.failed").tag("type", "fetch").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("shepherd.jobs.retried").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("shepherd.jobs.dead_lettered").counter().count()).isEqualTo(1.0);
    }
}
