package io.shepherd.example;

import io.shepherd.api.job.JobPayload;
import io.shepherd.api.job.WorkingPoolConfig;
import io.shepherd.api.manager.ManagerConfig;
import io.shepherd.api.pool.PoolType;
import io.shepherd.core.manager.DefaultPoolManager;
import io.shepherd.core.manager.PoolManagerLauncher;
import io.shepherd.core.schedule.ScheduleInstaller;
import io.shepherd.core.working.WorkingPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Example service wiring a manager with one working pool and a file-driven scheduler.
 * <p>
 * Run with:
 * <pre>{@code
 * mvn compile exec:java -pl shepherd-example \
 *   -Dexec.mainClass="io.shepherd.example.ExampleApplication" \
 *   -Dexec.args="shepherd-example/schedules.json"
 * }</pre>
 * Stop it with Ctrl+C; the shutdown hook cancels every pool and waits for them.
 */
public class ExampleApplication {

    private static final Logger log = LoggerFactory.getLogger(ExampleApplication.class);

    public static void main(String[] args) throws InterruptedException {
        var manager = new DefaultPoolManager(ManagerConfig.create()
                .commandQueueCapacity(10)
                .shutdownTimeout(Duration.ofSeconds(30)));
        PoolManagerLauncher.launch(manager);
        PoolManagerLauncher.installShutdownHook(manager);

        // ─── Working pool ───
        var dailyPool = new WorkingPool(WorkingPoolConfig.create()
                .queueNameBase("DailyPool")
                .numWorkers(4)
                .jobTimeout(Duration.ofSeconds(10))
                .rateLimit(5, 2));
        dailyPool.registerJob("fetch-weather", params -> {
            log.info("Fetching weather for region {}", params.get("region"));
            Thread.sleep(ThreadLocalRandom.current().nextLong(100, 500));
        });
        dailyPool.registerJob("check-farm", params -> {
            if (ThreadLocalRandom.current().nextInt(4) == 0) {
                throw new IllegalStateException("farm sensor unavailable");
            }
            log.info("Farm {} looks fine", params.get("farmId"));
        });
        manager.startPool(dailyPool.name(), dailyPool, PoolType.WORKING);

        // the scheduler installer resolves pools by name, so wait for the start command
        while (manager.getPool(dailyPool.name()).isEmpty()) {
            Thread.sleep(10);
        }

        // ─── Schedulers ───
        int installed = args.length > 0
                ? new ScheduleInstaller(manager).installFrom(Path.of(args[0]))
                : 0;
        if (installed == 0) {
            log.info("No schedules file given, submitting a one-off batch instead");
            for (int farm = 1; farm <= 5; farm++) {
                dailyPool.submitJob(JobPayload.of("check-farm", Map.of("farmId", farm), 2));
            }
        }

        log.info("Pools running: {}", manager.registeredPools());
    }
}
