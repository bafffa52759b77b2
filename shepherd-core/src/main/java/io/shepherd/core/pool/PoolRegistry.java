package io.shepherd.core.pool;

import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolStatus;
import io.shepherd.api.pool.PoolType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Name to running-pool mapping.
 * <p>
 * Only the manager's control loop writes; readers on any thread take the read lock.
 * Writes take the write lock too, so a reader never observes a half-applied change.
 */
public final class PoolRegistry {

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @return false if an entry with the same name is already registered
     */
    public boolean register(Entry entry) {
        lock.writeLock().lock();
        try {
            return entries.putIfAbsent(entry.name(), entry) == null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Entry> remove(String name) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(entries.remove(name));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return entries.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Pool> pool(String name) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(name);
            return entry == null ? Optional.empty() : Optional.of(entry.pool());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Entry> entries() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PoolStatus> snapshot() {
        List<PoolStatus> statuses = new ArrayList<>();
        for (Entry entry : entries()) {
            statuses.add(entry.status());
        }
        statuses.sort(Comparator.comparing(PoolStatus::name));
        return statuses;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A registered pool together with the context that cancels it.
     */
    public record Entry(
            String name,
            PoolType type,
            Pool pool,
            CancellableContext context,
            Instant startedAt
    ) {
        public PoolStatus status() {
            return new PoolStatus(name, type, startedAt, context.isCancelled());
        }
    }
}
