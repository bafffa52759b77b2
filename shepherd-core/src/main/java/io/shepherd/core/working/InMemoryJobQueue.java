package io.shepherd.core.working;

import io.shepherd.api.job.JobQueue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job queue held in process memory. Pending jobs are served oldest first.
 * Nothing survives a restart.
 */
public class InMemoryJobQueue implements JobQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<String> pending = new ArrayDeque<>();
    private final List<String> running = new ArrayList<>();
    private final List<String> deadLetters = new ArrayList<>();

    @Override
    public void push(String payload) {
        lock.lock();
        try {
            pending.addLast(payload);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> moveToRunning(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty()) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            String payload = pending.pollFirst();
            running.add(payload);
            return Optional.of(payload);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeFromRunning(String payload) {
        lock.lock();
        try {
            return running.remove(payload);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int requeueRunning() {
        lock.lock();
        try {
            int moved = running.size();
            running.forEach(pending::addLast);
            running.clear();
            if (moved > 0) {
                notEmpty.signalAll();
            }
            return moved;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deadLetter(String payload) {
        lock.lock();
        try {
            deadLetters.add(payload);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int pendingSize() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int runningSize() {
        lock.lock();
        try {
            return running.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> pendingJobs() {
        lock.lock();
        try {
            return List.copyOf(pending);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> deadLetters() {
        lock.lock();
        try {
            return List.copyOf(deadLetters);
        } finally {
            lock.unlock();
        }
    }
}
