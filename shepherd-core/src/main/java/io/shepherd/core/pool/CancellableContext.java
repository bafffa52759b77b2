package io.shepherd.core.pool;

import io.shepherd.api.pool.PoolContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation token organized as a tree.
 * Cancelling a context cancels all of its descendants; cancelling a child never affects
 * its parent. Cancellation is one-way and idempotent.
 */
public final class CancellableContext implements PoolContext {

    private static final Logger log = LoggerFactory.getLogger(CancellableContext.class);

    private final String poolName;
    private final CancellableContext parent;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    // guarded by this
    private final List<Runnable> callbacks = new ArrayList<>();
    private final Set<CancellableContext> children = new LinkedHashSet<>();
    private boolean done;

    private CancellableContext(String poolName, CancellableContext parent) {
        this.poolName = poolName;
        this.parent = parent;
    }

    public static CancellableContext root(String name) {
        return new CancellableContext(name, null);
    }

    /**
     * Derive a child context. A child of an already cancelled context starts cancelled.
     */
    public CancellableContext child(String name) {
        CancellableContext child = new CancellableContext(name, this);
        boolean parentDone;
        synchronized (this) {
            parentDone = done;
            if (!parentDone) {
                children.add(child);
            }
        }
        if (parentDone) {
            child.cancel();
        }
        return child;
    }

    /**
     * Cancel this context and every descendant, then run the registered callbacks.
     */
    public void cancel() {
        List<Runnable> toRun;
        List<CancellableContext> toCancel;
        synchronized (this) {
            if (done) {
                return;
            }
            done = true;
            toRun = new ArrayList<>(callbacks);
            toCancel = new ArrayList<>(children);
            callbacks.clear();
            children.clear();
        }
        cancelled.countDown();

        if (parent != null) {
            parent.detach(this);
        }
        toCancel.forEach(CancellableContext::cancel);
        toRun.forEach(this::runCallback);
    }

    @Override
    public String poolName() {
        return poolName;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    @Override
    public void awaitCancellation() throws InterruptedException {
        cancelled.await();
    }

    @Override
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!done) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    synchronized int childCount() {
        return children.size();
    }

    private synchronized void detach(CancellableContext child) {
        children.remove(child);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed for '{}'", poolName, e);
        }
    }

    @Override
    public String toString() {
        return "CancellableContext[" + poolName + (isCancelled() ? ", cancelled]" : "]");
    }
}
