package io.shepherd.core.schedule;

import io.shepherd.api.job.JobPayload;
import io.shepherd.api.pool.CompletionTracker;
import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolContext;
import io.shepherd.core.working.WorkingPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pool that submits a fixed set of jobs to a {@link WorkingPool} at a fixed interval.
 * Each tick submits a fresh copy of every job template, so every run gets its own job id.
 */
public class JobScheduler implements Pool {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final String name;
    private final Duration interval;
    private final WorkingPool target;
    private final List<JobPayload> jobs = new CopyOnWriteArrayList<>();
    private final AtomicLong runCount = new AtomicLong(0);

    public JobScheduler(String name, Duration interval, WorkingPool target) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Scheduler interval must be positive");
        }
        this.name = name;
        this.interval = interval;
        this.target = target;
    }

    public void addJob(JobPayload job) {
        jobs.add(job);
    }

    public String name() {
        return name;
    }

    public Duration interval() {
        return interval;
    }

    public List<JobPayload> jobs() {
        return List.copyOf(jobs);
    }

    /**
     * @return number of ticks that have fired so far
     */
    public long runCount() {
        return runCount.get();
    }

    @Override
    public void start(PoolContext context, CompletionTracker tracker) {
        ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "shepherd-scheduler-" + name);
            t.setDaemon(true);
            return t;
        });
        try {
            log.info("[Scheduler {}] Running every {}", name, interval);
            ticker.scheduleAtFixedRate(() -> {
                try {
                    submitJobs(context);
                } catch (Exception e) {
                    log.error("[Scheduler {}] Error submitting jobs", name, e);
                }
            }, interval.toNanos(), interval.toNanos(), TimeUnit.NANOSECONDS);

            context.awaitCancellation();
            log.info("[Scheduler {}] Shutting down.", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            ticker.shutdown();
            tracker.done();
        }
    }

    private void submitJobs(PoolContext context) {
        if (context.isCancelled()) {
            return;
        }
        runCount.incrementAndGet();
        log.info("[Scheduler {}] Ticker fired. Submitting {} jobs.", name, jobs.size());
        for (JobPayload template : jobs) {
            if (context.isCancelled()) {
                log.info("[Scheduler {}] Shutdown signalled, skipping remaining jobs", name);
                return;
            }
            target.submitJob(JobPayload.of(template.type(), template.params(), template.maxRetries()));
        }
    }
}
