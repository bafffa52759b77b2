package io.shepherd.core.manager;

import io.shepherd.api.pool.CompletionTracker;
import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolContext;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool that waits for cancellation, optionally lingers, then signals completion.
 */
class RecordingPool implements Pool {

    private final Duration lingerAfterCancel;
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicInteger startCount = new AtomicInteger(0);
    private volatile PoolContext context;
    private volatile boolean observedCancellation;

    RecordingPool() {
        this(Duration.ZERO);
    }

    RecordingPool(Duration lingerAfterCancel) {
        this.lingerAfterCancel = lingerAfterCancel;
    }

    @Override
    public void start(PoolContext context, CompletionTracker tracker) {
        this.context = context;
        startCount.incrementAndGet();
        started.countDown();
        try {
            context.awaitCancellation();
            observedCancellation = context.isCancelled();
            if (!lingerAfterCancel.isZero()) {
                Thread.sleep(lingerAfterCancel.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finished.countDown();
            tracker.done();
        }
    }

    boolean awaitStarted() throws InterruptedException {
        return started.await(5, TimeUnit.SECONDS);
    }

    boolean isFinished() {
        return finished.getCount() == 0;
    }

    boolean observedCancellation() {
        return observedCancellation;
    }

    int startCount() {
        return startCount.get();
    }

    PoolContext context() {
        return context;
    }
}
