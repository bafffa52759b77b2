package io.shepherd.api.manager;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for a pool manager.
 * Controls command backpressure and how long shutdown waits for pools.
 */
public final class ManagerConfig {

    private int commandQueueCapacity = 10;
    private Duration shutdownTimeout = null; // null = wait forever
    private String threadNamePrefix = "shepherd";

    private ManagerConfig() {}

    public static ManagerConfig create() {
        return new ManagerConfig();
    }

    public ManagerConfig commandQueueCapacity(int commandQueueCapacity) {
        if (commandQueueCapacity <= 0) {
            throw new IllegalArgumentException("Command queue capacity must be positive");
        }
        this.commandQueueCapacity = commandQueueCapacity;
        return this;
    }

    /**
     * Bound the time {@code shutdown()} waits for pools. Pools still running when it
     * expires are logged and abandoned; they are never interrupted.
     */
    public ManagerConfig shutdownTimeout(Duration shutdownTimeout) {
        if (shutdownTimeout != null && (shutdownTimeout.isNegative() || shutdownTimeout.isZero())) {
            throw new IllegalArgumentException("Shutdown timeout must be positive");
        }
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    public ManagerConfig threadNamePrefix(String threadNamePrefix) {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("Thread name prefix must not be blank");
        }
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public int commandQueueCapacity() { return commandQueueCapacity; }
    public Optional<Duration> shutdownTimeout() { return Optional.ofNullable(shutdownTimeout); }
    public String threadNamePrefix() { return threadNamePrefix; }
}
