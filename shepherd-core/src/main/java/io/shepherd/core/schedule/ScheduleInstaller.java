package io.shepherd.core.schedule;

import io.shepherd.api.manager.PoolManager;
import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolType;
import io.shepherd.core.working.WorkingPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Registers a {@link JobScheduler} with the manager for every valid schedule record.
 * Target pools are resolved by name through {@link PoolManager#getPool}, so they must be
 * registered (and their start command processed) beforehand.
 */
public class ScheduleInstaller {

    private static final Logger log = LoggerFactory.getLogger(ScheduleInstaller.class);

    private final PoolManager manager;
    private final ScheduleLoader loader;

    public ScheduleInstaller(PoolManager manager) {
        this(manager, new ScheduleLoader());
    }

    public ScheduleInstaller(PoolManager manager, ScheduleLoader loader) {
        this.manager = manager;
        this.loader = loader;
    }

    /**
     * Load and install schedules from a file. An unreadable file installs nothing.
     *
     * @return number of schedulers submitted to the manager
     */
    public int installFrom(Path file) {
        List<ScheduleRecord> records;
        try {
            records = loader.load(file);
        } catch (IOException e) {
            log.warn("Could not load schedules from {}: {}", file, e.getMessage());
            return 0;
        }
        log.info("Loading schedulers from {} (count={})", file, records.size());
        return install(records);
    }

    public int install(List<ScheduleRecord> records) {
        int installed = 0;
        for (ScheduleRecord record : records) {
            Optional<JobScheduler> scheduler = build(record);
            if (scheduler.isPresent()) {
                manager.startPool(record.name(), scheduler.get(), PoolType.SCHEDULER);
                installed++;
            }
        }
        log.info("Schedulers installed: {} of {}", installed, records.size());
        return installed;
    }

    private Optional<JobScheduler> build(ScheduleRecord record) {
        if (record.name() == null || record.name().isBlank()) {
            log.error("Scheduler without a name, skipping (pool_name={})", record.poolName());
            return Optional.empty();
        }

        Optional<Pool> pool = record.poolName() == null ? Optional.empty() : manager.getPool(record.poolName());
        if (pool.isEmpty() || !(pool.get() instanceof WorkingPool target)) {
            log.error("Pool not found for scheduler, skipping: scheduler={}, pool={}", record.name(), record.poolName());
            return Optional.empty();
        }

        Duration interval;
        try {
            interval = DurationParser.parse(record.interval());
        } catch (IllegalArgumentException e) {
            log.error("Invalid interval for scheduler, skipping: scheduler={}, interval={}", record.name(), record.interval());
            return Optional.empty();
        }

        JobScheduler scheduler = new JobScheduler(record.name(), interval, target);
        try {
            for (ScheduleRecord.JobTemplate job : record.jobs()) {
                scheduler.addJob(job.toPayload());
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            log.error("Invalid job in scheduler, skipping: scheduler={}, reason={}", record.name(), e.getMessage());
            return Optional.empty();
        }
        log.info("Scheduler loaded: scheduler={}, interval={}, jobs={}", record.name(), interval, record.jobs().size());
        return Optional.of(scheduler);
    }
}
