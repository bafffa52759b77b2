package io.shepherd.core.manager;

import io.shepherd.api.manager.PoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a manager's control loop on a dedicated thread and ties its shutdown to the JVM's.
 * <p>
 * Usage:
 * <pre>{@code
 * var manager = new DefaultPoolManager();
 * PoolManagerLauncher.launch(manager);
 * PoolManagerLauncher.installShutdownHook(manager);
 * }</pre>
 */
public final class PoolManagerLauncher {

    private static final Logger log = LoggerFactory.getLogger(PoolManagerLauncher.class);

    public static final String DEFAULT_THREAD_NAME = "shepherd-manager";

    private PoolManagerLauncher() {}

    public static Thread launch(PoolManager manager) {
        return launch(manager, DEFAULT_THREAD_NAME);
    }

    /**
     * Start {@link PoolManager#run()} on a new non-daemon thread.
     */
    public static Thread launch(PoolManager manager, String threadName) {
        Thread loop = new Thread(manager::run, threadName);
        loop.setUncaughtExceptionHandler((t, e) -> log.error("Manager loop on '{}' terminated unexpectedly", t.getName(), e));
        loop.start();
        log.info("Manager loop launched on thread '{}'", threadName);
        return loop;
    }

    /**
     * Register a JVM shutdown hook that shuts the manager down.
     *
     * @return the hook thread, so callers can remove it again
     */
    public static Thread installShutdownHook(PoolManager manager) {
        Thread hook = new Thread(() -> {
            log.info("Termination signal received, shutting down pools");
            manager.shutdown();
        }, DEFAULT_THREAD_NAME + "-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }
}
