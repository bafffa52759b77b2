package io.shepherd.api.pool;

/**
 * A named unit of long-running concurrent work managed as a group.
 * <p>
 * The manager invokes {@link #start} on a thread of its own and never inspects the pool
 * beyond that call. The pool runs until its context is cancelled, then returns.
 * <p>
 * Implementations must call {@link CompletionTracker#done()} exactly once, on every exit
 * path (including failures), before {@code start} returns:
 * <pre>{@code
 * public void start(PoolContext context, CompletionTracker tracker) {
 *     try {
 *         while (!context.isCancelled()) {
 *             pollSomething();
 *         }
 *     } finally {
 *         tracker.done();
 *     }
 * }
 * }</pre>
 */
@FunctionalInterface
public interface Pool {

    /**
     * Run this pool until {@code context} is cancelled.
     *
     * @param context cancellation token owned by the manager
     * @param tracker shared completion tracker, decremented once when this pool exits
     */
    void start(PoolContext context, CompletionTracker tracker);
}
