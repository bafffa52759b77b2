package io.shepherd.core.working;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.shepherd.api.job.JobHandler;
import io.shepherd.api.job.JobPayload;
import io.shepherd.api.job.JobQueue;
import io.shepherd.api.job.WorkingPoolConfig;
import io.shepherd.api.metrics.PoolMetrics;
import io.shepherd.api.pool.CompletionTracker;
import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolContext;
import io.shepherd.core.metrics.MicrometerPoolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of workers consuming jobs from a {@link JobQueue}.
 * <p>
 * Each worker moves a job from the pending to the running list, checks the daily quota,
 * waits for a rate-limit permit, runs the registered {@link JobHandler} bounded by the job
 * timeout, and finally removes the job from the running list. Failed jobs are pushed back
 * to pending until they run out of retries, then moved to the dead-letter list.
 * <p>
 * Jobs left on the running list by a crashed process are moved back to pending when the
 * pool starts.
 */
public class WorkingPool implements Pool {

    private static final Logger log = LoggerFactory.getLogger(WorkingPool.class);

    private static final long PERMIT_RECHECK_MS = 100;
    private static final long JOB_POLL_MS = 100;

    private final WorkingPoolConfig config;
    private final JobQueue queue;
    private final PoolMetrics metrics;
    private final JobCodec codec = new JobCodec();
    private final Map<String, JobHandler> dispatcher = new ConcurrentHashMap<>();
    private final RateLimiter rateLimiter;
    private final DailyQuota quota;
    private final AtomicInteger activeWorkers = new AtomicInteger(0);

    public WorkingPool(WorkingPoolConfig config) {
        this(config, new InMemoryJobQueue(), new MicrometerPoolMetrics());
    }

    public WorkingPool(WorkingPoolConfig config, JobQueue queue, PoolMetrics metrics) {
        this(config, queue, metrics, Clock.systemUTC());
    }

    WorkingPool(WorkingPoolConfig config, JobQueue queue, PoolMetrics metrics, Clock clock) {
        this.config = config;
        this.queue = queue;
        this.metrics = metrics;
        this.quota = new DailyQuota(config.dailyQuota(), clock);
        this.rateLimiter = config.rateLimited() ? createRateLimiter(config) : null;
    }

    /**
     * @return the first segment of the queue name base, e.g. {@code queue} for {@code queue:general}
     */
    public String name() {
        return config.queueNameBase().split(":")[0];
    }

    public WorkingPoolConfig config() {
        return config;
    }

    public JobQueue queue() {
        return queue;
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public void registerJob(String jobType, JobHandler handler) {
        dispatcher.put(jobType, handler);
        log.debug("Registered handler for job type '{}' on {}", jobType, config.queueNameBase());
    }

    /**
     * Serialize the job and push it onto the pending queue.
     *
     * @throws IllegalArgumentException if the job's parameters cannot be serialized
     */
    public void submitJob(JobPayload job) {
        queue.push(codec.encode(job));
    }

    @Override
    public void start(PoolContext context, CompletionTracker tracker) {
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService workers = null;
        ExecutorService jobs = null;
        try {
            log.info("Working pool starting: queue={}, workers={}, jobTimeout={}",
                    config.pendingQueueName(), config.numWorkers(), config.jobTimeout());

            requeueStaleJobs();

            String threadPrefix = "shepherd-worker-" + name() + "-";
            AtomicInteger threadIds = new AtomicInteger(0);
            workers = Executors.newFixedThreadPool(config.numWorkers(), r -> {
                Thread t = new Thread(r, threadPrefix + threadIds.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            jobs = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "shepherd-job-" + name());
                t.setDaemon(true);
                return t;
            });

            for (int i = 0; i < config.numWorkers(); i++) {
                int workerId = i + 1;
                ExecutorService jobExecutor = jobs;
                workers.execute(() -> workerLoop(context, running, jobExecutor, workerId));
            }

            context.awaitCancellation();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Working pool {} interrupted before cancellation; stopping workers", config.queueNameBase());
        } finally {
            running.set(false);
            awaitWorkers(workers);
            if (jobs != null) {
                jobs.shutdown();
            }
            log.info("Working pool stopped, all workers exited: queue={}", config.pendingQueueName());
            tracker.done();
        }
    }

    // ─── Worker ───

    private void workerLoop(PoolContext context, AtomicBoolean running, ExecutorService jobs, int workerId) {
        MDC.put("pool", name());
        MDC.put("workerId", String.valueOf(workerId));
        activeWorkers.incrementAndGet();
        log.info("Worker {} started on {}", workerId, config.pendingQueueName());
        try {
            while (isActive(context, running)) {
                Optional<String> next = queue.moveToRunning(config.pollTimeout());
                if (next.isEmpty()) {
                    continue; // poll timeout, re-check for shutdown
                }
                process(context, running, jobs, next.get(), workerId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Worker {} on {} crashed", workerId, config.pendingQueueName(), e);
        } finally {
            activeWorkers.decrementAndGet();
            log.info("Worker {} shutting down", workerId);
            MDC.clear();
        }
    }

    private void process(PoolContext context, AtomicBoolean running, ExecutorService jobs,
                         String payload, int workerId) throws InterruptedException {
        JobPayload job;
        try {
            job = codec.decode(payload);
        } catch (IOException e) {
            log.error("Failed to decode job payload, moving it to {}", config.deadLetterQueueName(), e);
            queue.removeFromRunning(payload);
            queue.deadLetter(payload);
            metrics.recordJobDeadLettered(name(), "unknown");
            return;
        }

        MDC.put("jobId", job.jobId());
        MDC.put("jobType", job.type());
        try {
            if (!quota.tryAcquire()) {
                log.warn("Daily quota of {} exceeded, re-queueing job {}", config.dailyQuota(), job.jobId());
                requeue(payload);
                context.awaitCancellation(config.quotaBackoff());
                return;
            }

            if (!acquirePermit(context, running)) {
                log.info("Cancelled while waiting for rate-limit permit, re-queueing job {}", job.jobId());
                requeue(payload);
                return;
            }

            Instant started = Instant.now();
            Throwable error = dispatch(context, jobs, job);
            Duration elapsed = Duration.between(started, Instant.now());
            handleResult(payload, job, error, elapsed);
        } finally {
            MDC.remove("jobId");
            MDC.remove("jobType");
        }
    }

    private boolean acquirePermit(PoolContext context, AtomicBoolean running) throws InterruptedException {
        if (rateLimiter == null) {
            return true;
        }
        while (isActive(context, running)) {
            if (rateLimiter.acquirePermission()) {
                return true;
            }
            context.awaitCancellation(Duration.ofMillis(PERMIT_RECHECK_MS));
        }
        return false;
    }

    /**
     * Run the job's handler on the job executor.
     *
     * @return null on success, otherwise the failure
     */
    private Throwable dispatch(PoolContext context, ExecutorService jobs, JobPayload job) throws InterruptedException {
        JobHandler handler = dispatcher.get(job.type());
        if (handler == null) {
            log.error("Unknown job type '{}' for job {}", job.type(), job.jobId());
            return new IllegalArgumentException("Unknown job type: " + job.type());
        }

        log.info("Executing job {} (type={}, attempt {} of {})",
                job.jobId(), job.type(), job.retryCount() + 1, job.maxRetries() + 1);

        Future<?> future = jobs.submit(() -> {
            handler.handle(job.params());
            return null;
        });

        long deadline = System.nanoTime() + config.jobTimeout().toNanos();
        while (true) {
            try {
                future.get(JOB_POLL_MS, TimeUnit.MILLISECONDS);
                log.info("Job {} completed successfully", job.jobId());
                return null;
            } catch (ExecutionException e) {
                log.error("Job {} execution failed", job.jobId(), e.getCause());
                return e.getCause();
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            } catch (TimeoutException e) {
                if (context.isCancelled()) {
                    future.cancel(true);
                    log.warn("Job {} cancelled by shutdown", job.jobId());
                    return new CancellationException("Job cancelled by shutdown");
                }
                if (System.nanoTime() - deadline >= 0) {
                    future.cancel(true);
                    log.error("Job {} timed out after {}", job.jobId(), config.jobTimeout());
                    return new TimeoutException("Job timed out after " + config.jobTimeout());
                }
            }
        }
    }

    private void handleResult(String payload, JobPayload job, Throwable error, Duration elapsed) {
        if (!queue.removeFromRunning(payload)) {
            log.error("Job {} was not on {} when it finished", job.jobId(), config.runningQueueName());
        }

        if (error == null) {
            metrics.recordJobCompleted(name(), job.type(), elapsed);
            return;
        }
        metrics.recordJobFailed(name(), job.type(), elapsed, error);

        if (job.canRetry()) {
            JobPayload next = job.nextAttempt();
            log.info("Retrying job {} (retry {} of {})", job.jobId(), next.retryCount(), next.maxRetries());
            queue.push(codec.encode(next));
            metrics.recordJobRetried(name(), job.type());
        } else {
            log.warn("Job {} exceeded max retries ({}), moving to {}",
                    job.jobId(), job.maxRetries(), config.deadLetterQueueName());
            queue.deadLetter(payload);
            metrics.recordJobDeadLettered(name(), job.type());
        }
    }

    private void requeue(String payload) {
        queue.removeFromRunning(payload);
        queue.push(payload);
    }

    private void requeueStaleJobs() {
        int requeued = queue.requeueRunning();
        if (requeued > 0) {
            log.info("Requeued {} stale job(s) from {}", requeued, config.runningQueueName());
        } else {
            log.debug("No stale jobs found on {}", config.runningQueueName());
        }
    }

    private static boolean isActive(PoolContext context, AtomicBoolean running) {
        return running.get() && !context.isCancelled();
    }

    private void awaitWorkers(ExecutorService workers) {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            while (!workers.awaitTermination(config.pollTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Waiting for workers on {} to exit", config.pendingQueueName());
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static RateLimiter createRateLimiter(WorkingPoolConfig config) {
        long refreshNanos = Math.max(1L, (long) (config.burst() * 1_000_000_000L / config.callsPerSecond()));
        log.info("Creating rate limiter for {}: {} calls/s, burst {}",
                config.queueNameBase(), config.callsPerSecond(), config.burst());
        return RateLimiter.of(
                "pool-" + config.queueNameBase(),
                RateLimiterConfig.custom()
                        .limitRefreshPeriod(Duration.ofNanos(refreshNanos))
                        .limitForPeriod(config.burst())
                        .timeoutDuration(Duration.ZERO)
                        .build()
        );
    }
}
