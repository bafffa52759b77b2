package io.shepherd.api.pool;

/**
 * Shared counter the manager waits on during shutdown.
 * Every spawned pool signals {@link #done()} exactly once when it exits.
 */
@FunctionalInterface
public interface CompletionTracker {

    void done();
}
