package io.shepherd.api.manager;

import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolStatus;
import io.shepherd.api.pool.PoolType;

import java.util.List;
import java.util.Optional;

/**
 * Process-wide supervisor that starts, tracks and stops named pools.
 * <p>
 * All registry mutations are serialized through a single control loop ({@link #run()}).
 * {@link #startPool} and {@link #stopPool} only enqueue commands: they return before the
 * command is processed and never report administrative no-ops (duplicate start, unknown
 * stop) to the caller. Those are logged instead.
 * <p>
 * Typical lifecycle:
 * <pre>{@code
 * PoolManager manager = new DefaultPoolManager();
 * Thread loop = new Thread(manager::run, "shepherd-manager");
 * loop.start();
 *
 * manager.startPool("ingest", ingestPool, PoolType.WORKING);
 * ...
 * manager.shutdown(); // cancels every pool and waits for all of them
 * }</pre>
 */
public interface PoolManager {

    /**
     * Run the control loop on the calling thread. Returns once shutdown has been observed
     * and every registered pool has been signalled. Must be invoked exactly once.
     *
     * @throws IllegalStateException if the loop is already running or has run
     */
    void run();

    /**
     * Enqueue a start command. Blocks while the command queue is full.
     * If {@code name} is already registered when the command is processed, the command is
     * ignored and the original pool stays in place.
     *
     * @throws ManagerShutdownException if shutdown has begun
     */
    void startPool(String name, Pool pool, PoolType type);

    /**
     * Non-blocking variant of {@link #startPool}.
     *
     * @return false if the command queue is full
     */
    boolean tryStartPool(String name, Pool pool, PoolType type);

    /**
     * Enqueue a stop command. Blocks while the command queue is full.
     * Stopping cancels the pool's context; it does not wait for the pool to return.
     *
     * @throws ManagerShutdownException if shutdown has begun
     */
    void stopPool(String name);

    /**
     * Non-blocking variant of {@link #stopPool}.
     *
     * @return false if the command queue is full
     */
    boolean tryStopPool(String name);

    /**
     * Synchronous lookup that bypasses the command queue.
     */
    Optional<Pool> getPool(String name);

    /**
     * @return snapshots of every registered pool, ordered by name
     */
    List<PoolStatus> registeredPools();

    ManagerState state();

    /**
     * Cancel every pool, wait until all of them have signalled completion, then close the
     * command queue. Only the first call has any effect.
     * <p>
     * Without a configured shutdown timeout this blocks forever on a pool that never
     * observes cancellation.
     *
     * @return true if every pool completed, false if the shutdown timeout expired first
     */
    boolean shutdown();
}
