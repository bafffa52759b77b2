package io.shepherd.core.pool;

import io.shepherd.api.pool.CompletionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Per-pool view of the shared completion latch that lets a pool decrement it at most once.
 */
public final class GuardedTracker implements CompletionTracker {

    private static final Logger log = LoggerFactory.getLogger(GuardedTracker.class);

    private final String poolName;
    private final CompletionLatch latch;
    private final Consumer<GuardedTracker> onDone;
    private final AtomicBoolean signalled = new AtomicBoolean(false);

    public GuardedTracker(String poolName, CompletionLatch latch, Consumer<GuardedTracker> onDone) {
        this.poolName = poolName;
        this.latch = latch;
        this.onDone = onDone;
    }

    @Override
    public void done() {
        if (!signalled.compareAndSet(false, true)) {
            log.warn("Pool '{}' signalled completion more than once; ignoring", poolName);
            return;
        }
        onDone.accept(this);
        latch.done();
    }

    public boolean signalled() {
        return signalled.get();
    }

    public String poolName() {
        return poolName;
    }
}
