package io.shepherd.core.pool;

import io.shepherd.api.pool.CompletionTracker;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting wait group. Incremented before work is spawned, decremented as each unit
 * finishes; {@link #await()} blocks until the count returns to zero.
 * Unlike {@link java.util.concurrent.CountDownLatch} the count may go up again after
 * reaching zero.
 */
public final class CompletionLatch implements CompletionTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private long pending;

    public void add(int delta) {
        lock.lock();
        try {
            long next = pending + delta;
            if (next < 0) {
                throw new IllegalStateException("Completion count would become negative: " + next);
            }
            pending = next;
            if (pending == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void done() {
        add(-1);
    }

    public long pending() {
        lock.lock();
        try {
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public void await() throws InterruptedException {
        lock.lock();
        try {
            while (pending > 0) {
                drained.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the count reached zero, false if the timeout elapsed first
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (pending > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = drained.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "CompletionLatch[pending=" + pending() + "]";
    }
}
