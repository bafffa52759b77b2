package io.shepherd.core.schedule;

import io.shepherd.api.job.JobPayload;
import io.shepherd.api.job.WorkingPoolConfig;
import io.shepherd.core.metrics.MicrometerPoolMetrics;
import io.shepherd.core.pool.CancellableContext;
import io.shepherd.core.pool.CompletionLatch;
import io.shepherd.core.working.InMemoryJobQueue;
import io.shepherd.core.working.JobCodec;
import io.shepherd.core.working.WorkingPool;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JobSchedulerTest {

    private final InMemoryJobQueue queue = new InMemoryJobQueue();
    private final WorkingPool target = new WorkingPool(WorkingPoolConfig.create(), queue, new MicrometerPoolMetrics());

    @Test
    void shouldSubmitFreshCopiesOfEveryJobOnEachTick() throws Exception {
        var scheduler = new JobScheduler("ticker", Duration.ofMillis(50), target);
        scheduler.addJob(JobPayload.of("fetch-weather", Map.of("region", "north"), 3));
        scheduler.addJob(JobPayload.of("check-farm", Map.of(), 1));
        var context = CancellableContext.root("ticker");
        var latch = new CompletionLatch();
        latch.add(1);

        Thread thread = new Thread(() -> scheduler.start(context, latch));
        thread.start();
        await().atMost(5, TimeUnit.SECONDS).until(() -> scheduler.runCount() >= 2);
        context.cancel();

        assertThat(latch.await(Duration.ofSeconds(5))).isTrue();
        thread.join(1000);

        var codec = new JobCodec();
        Set<String> ids = new HashSet<>();
        int submitted = queue.pendingSize();
        for (int i = 0; i < submitted; i++) {
            JobPayload job = codec.decode(queue.moveToRunning(Duration.ofMillis(10)).orElseThrow());
            ids.add(job.jobId());
            assertThat(job.retryCount()).isZero();
        }
        assertThat(submitted).isGreaterThanOrEqualTo(4).isEven();
        assertThat(ids).hasSize(submitted);
    }

    @Test
    void shouldNotTickBeforeFirstInterval() throws Exception {
        var scheduler = new JobScheduler("slow", Duration.ofHours(1), target);
        scheduler.addJob(JobPayload.of("fetch-weather", Map.of(), 0));
        var context = CancellableContext.root("slow");
        var latch = new CompletionLatch();
        latch.add(1);

        Thread thread = new Thread(() -> scheduler.start(context, latch));
        thread.start();
        Thread.sleep(100);
        context.cancel();

        assertThat(latch.await(Duration.ofSeconds(5))).isTrue();
        assertThat(scheduler.runCount()).isZero();
        assertThat(queue.pendingSize()).isZero();
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new JobScheduler("bad", Duration.ZERO, target))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
