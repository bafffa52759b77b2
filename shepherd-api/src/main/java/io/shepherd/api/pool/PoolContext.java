package io.shepherd.api.pool;

import java.time.Duration;

/**
 * Cancellation token handed to a running pool.
 * <p>
 * Cancellation is cooperative: the manager only flips the token, the pool is expected to
 * observe it (by polling {@link #isCancelled()}, blocking in {@link #awaitCancellation()}
 * or registering a callback) and return promptly.
 */
public interface PoolContext {

    /**
     * @return the name of the pool (or manager) this context belongs to
     */
    String poolName();

    /**
     * @return true once this context or any of its ancestors has been cancelled
     */
    boolean isCancelled();

    /**
     * Block until this context is cancelled.
     */
    void awaitCancellation() throws InterruptedException;

    /**
     * Block until this context is cancelled or the timeout elapses.
     *
     * @return true if cancelled, false on timeout
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException;

    /**
     * Register a callback run once on cancellation. If the context is already cancelled
     * the callback runs immediately on the calling thread.
     */
    void onCancel(Runnable callback);
}
