package io.shepherd.core.manager;

import io.shepherd.api.manager.ManagerConfig;
import io.shepherd.api.manager.ManagerShutdownException;
import io.shepherd.api.manager.ManagerState;
import io.shepherd.api.manager.PoolManager;
import io.shepherd.api.metrics.PoolMetrics;
import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolStatus;
import io.shepherd.api.pool.PoolType;
import io.shepherd.core.metrics.MicrometerPoolMetrics;
import io.shepherd.core.pool.CancellableContext;
import io.shepherd.core.pool.CompletionLatch;
import io.shepherd.core.pool.GuardedTracker;
import io.shepherd.core.pool.PoolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Pool manager driven by a single control loop.
 * <p>
 * Callers enqueue {@link PoolCommand}s onto a bounded queue; {@link #run()} drains them in
 * submission order and is the only code path that mutates the registry. Shutdown cancels
 * the root context, which wakes the loop, and every pool context derives from it.
 * <p>
 * Each pool runs on its own thread from a cached executor. The manager never interrupts
 * a pool: a pool that ignores its context keeps {@link #shutdown()} waiting, unless a
 * shutdown timeout is configured.
 */
public class DefaultPoolManager implements PoolManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultPoolManager.class);

    private static final long SUBMIT_RECHECK_MS = 100;

    private final ManagerConfig config;
    private final PoolMetrics metrics;
    private final BlockingQueue<PoolCommand> commands;
    private final PoolRegistry registry = new PoolRegistry();
    private final CompletionLatch completion = new CompletionLatch();
    private final Set<GuardedTracker> outstanding = ConcurrentHashMap.newKeySet();
    private final CancellableContext rootContext;
    private final ExecutorService poolExecutor;

    private final AtomicReference<ManagerState> state = new AtomicReference<>(ManagerState.NEW);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final CountDownLatch loopExited = new CountDownLatch(1);
    private final Object wakeLock = new Object();
    private Thread loopThread; // guarded by wakeLock

    public DefaultPoolManager() {
        this(ManagerConfig.create());
    }

    public DefaultPoolManager(ManagerConfig config) {
        this(config, new MicrometerPoolMetrics());
    }

    public DefaultPoolManager(ManagerConfig config, PoolMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.commands = new ArrayBlockingQueue<>(config.commandQueueCapacity());
        this.rootContext = CancellableContext.root(config.threadNamePrefix() + "-manager");
        this.poolExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void run() {
        if (!state.compareAndSet(ManagerState.NEW, ManagerState.RUNNING)) {
            throw new IllegalStateException("Manager loop cannot start in state " + state.get());
        }
        synchronized (wakeLock) {
            loopThread = Thread.currentThread();
        }
        rootContext.onCancel(this::wakeLoop);

        log.info("[Manager] Running...");
        try {
            while (!rootContext.isCancelled()) {
                PoolCommand command;
                try {
                    command = commands.take();
                } catch (InterruptedException e) {
                    if (rootContext.isCancelled()) {
                        break;
                    }
                    log.warn("[Manager] Loop interrupted without a shutdown request; continuing");
                    continue;
                }
                process(command);
            }

            log.info("[Manager] Shutdown signal received. Stopping all pools...");
            for (PoolRegistry.Entry entry : registry.entries()) {
                log.info("[Manager] Signalling pool '{}' to stop", entry.name());
                entry.context().cancel();
            }
        } finally {
            synchronized (wakeLock) {
                loopThread = null;
            }
            // the wake-up interrupt is ours, not the caller's
            Thread.interrupted();
            state.set(ManagerState.STOPPED);
            loopExited.countDown();
            log.info("[Manager] Halted.");
        }
    }

    @Override
    public void startPool(String name, Pool pool, PoolType type) {
        submit(new PoolCommand.Start(name, type, pool));
    }

    @Override
    public boolean tryStartPool(String name, Pool pool, PoolType type) {
        return trySubmit(new PoolCommand.Start(name, type, pool));
    }

    @Override
    public void stopPool(String name) {
        submit(new PoolCommand.Stop(name));
    }

    @Override
    public boolean tryStopPool(String name) {
        return trySubmit(new PoolCommand.Stop(name));
    }

    @Override
    public Optional<Pool> getPool(String name) {
        return registry.pool(name);
    }

    @Override
    public List<PoolStatus> registeredPools() {
        return registry.snapshot();
    }

    @Override
    public ManagerState state() {
        return state.get();
    }

    @Override
    public boolean shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            log.warn("[Manager] Shutdown already requested; ignoring");
            return completion.pending() == 0;
        }

        log.info("[Manager] Initiating shutdown...");
        boolean loopActive = state.compareAndSet(ManagerState.RUNNING, ManagerState.SHUTTING_DOWN);
        if (!loopActive) {
            state.compareAndSet(ManagerState.NEW, ManagerState.STOPPED);
        }
        Optional<Duration> timeout = config.shutdownTimeout();
        long deadline = timeout.map(t -> System.nanoTime() + t.toNanos()).orElse(0L);

        rootContext.cancel();

        boolean completed;
        try {
            // the loop must be gone before waiting on the latch, or it could still spawn a pool
            completed = (!loopActive || awaitLoop(timeout, deadline)) && awaitPools(timeout, deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Manager] Interrupted while waiting for pools: {}", describeOutstanding());
            completed = false;
        } finally {
            closeCommandQueue();
            poolExecutor.shutdown();
        }

        if (completed) {
            log.info("[Manager] Shutdown complete.");
        } else {
            log.warn("[Manager] Shutdown did not complete within {}; abandoning pools still running: {}",
                    timeout.map(Duration::toString).orElse("the wait"), describeOutstanding());
        }
        return completed;
    }

    // ─── Control loop ───

    private void process(PoolCommand command) {
        if (command instanceof PoolCommand.Start start) {
            handleStart(start);
        } else if (command instanceof PoolCommand.Stop stop) {
            handleStop(stop.name());
        }
    }

    private void handleStart(PoolCommand.Start command) {
        String name = command.name();
        if (registry.contains(name)) {
            log.warn("[Manager] Warning: Pool '{}' already exists.", name);
            metrics.recordCommandIgnored("duplicate");
            return;
        }

        log.info("[Manager] Starting pool '{}' (type={})", name, command.type());
        CancellableContext poolContext = rootContext.child(name);
        registry.register(new PoolRegistry.Entry(name, command.type(), command.pool(), poolContext, Instant.now()));

        completion.add(1);
        GuardedTracker tracker = new GuardedTracker(name, completion, outstanding::remove);
        outstanding.add(tracker);
        try {
            poolExecutor.execute(() -> runPool(command, poolContext, tracker));
        } catch (RejectedExecutionException e) {
            log.error("[Manager] Could not spawn pool '{}'", name, e);
            registry.remove(name);
            poolContext.cancel();
            tracker.done();
            return;
        }

        metrics.recordPoolStarted(name, command.type());
        metrics.recordActivePools(registry.size());
    }

    private void handleStop(String name) {
        Optional<PoolRegistry.Entry> removed = registry.remove(name);
        if (removed.isEmpty()) {
            log.warn("[Manager] Warning: Pool '{}' not found.", name);
            metrics.recordCommandIgnored("unknown");
            return;
        }

        log.info("[Manager] Stopping pool '{}'", name);
        removed.get().context().cancel();
        metrics.recordPoolStopped(name);
        metrics.recordActivePools(registry.size());
    }

    private void runPool(PoolCommand.Start command, CancellableContext context, GuardedTracker tracker) {
        Thread current = Thread.currentThread();
        String previousName = current.getName();
        current.setName(config.threadNamePrefix() + "-pool-" + command.name());
        try {
            command.pool().start(context, tracker);
        } catch (RuntimeException e) {
            log.error("[Manager] Pool '{}' failed", command.name(), e);
        } finally {
            if (!tracker.signalled()) {
                log.error("[Manager] Pool '{}' returned without signalling completion", command.name());
                tracker.done();
            }
            current.setName(previousName);
        }
    }

    private void wakeLoop() {
        synchronized (wakeLock) {
            if (loopThread != null) {
                loopThread.interrupt();
            }
        }
    }

    // ─── Command submission ───

    private void submit(PoolCommand command) {
        ensureOpen();
        try {
            while (!commands.offer(command, SUBMIT_RECHECK_MS, TimeUnit.MILLISECONDS)) {
                ensureOpen();
            }
            withdrawIfClosed(command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while submitting command for pool '" + command.name() + "'", e);
        }
    }

    private boolean trySubmit(PoolCommand command) {
        ensureOpen();
        if (!commands.offer(command)) {
            return false;
        }
        withdrawIfClosed(command);
        return true;
    }

    // a command that slipped in after the queue was closed would never be processed
    private void withdrawIfClosed(PoolCommand command) {
        if (shutdownRequested.get() && commands.remove(command)) {
            throw new ManagerShutdownException("Pool manager is shut down");
        }
    }

    private void ensureOpen() {
        if (shutdownRequested.get()) {
            throw new ManagerShutdownException("Pool manager is shut down");
        }
    }

    private void closeCommandQueue() {
        int dropped = commands.size();
        commands.clear();
        if (dropped > 0) {
            log.warn("[Manager] Dropped {} unprocessed command(s) at shutdown", dropped);
        }
    }

    // ─── Shutdown waits ───

    private boolean awaitLoop(Optional<Duration> timeout, long deadline) throws InterruptedException {
        if (timeout.isEmpty()) {
            loopExited.await();
            return true;
        }
        return loopExited.await(remaining(deadline), TimeUnit.NANOSECONDS);
    }

    private boolean awaitPools(Optional<Duration> timeout, long deadline) throws InterruptedException {
        if (timeout.isEmpty()) {
            completion.await();
            return true;
        }
        return completion.await(Duration.ofNanos(remaining(deadline)));
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private String describeOutstanding() {
        return outstanding.stream()
                .map(GuardedTracker::poolName)
                .sorted()
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
