package io.shepherd.api.job;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Reliable queue backing a working pool: pending, running and dead-letter lists of
 * serialized job payloads.
 * <p>
 * A job is moved to the running list while a worker processes it, so a crashed worker
 * leaves it there and {@link #requeueRunning()} can recover it on the next start.
 */
public interface JobQueue {

    /**
     * Push a serialized job onto the pending list.
     */
    void push(String payload);

    /**
     * Atomically move the oldest pending job to the running list, waiting up to
     * {@code timeout} for one to arrive.
     *
     * @return the moved payload, or empty on timeout
     */
    Optional<String> moveToRunning(Duration timeout) throws InterruptedException;

    /**
     * Remove one occurrence of {@code payload} from the running list.
     *
     * @return true if it was present
     */
    boolean removeFromRunning(String payload);

    /**
     * Move every job from the running list back to the pending list.
     *
     * @return the number of jobs moved
     */
    int requeueRunning();

    void deadLetter(String payload);

    int pendingSize();

    int runningSize();

    /**
     * @return pending payloads, oldest first
     */
    List<String> pendingJobs();

    List<String> deadLetters();
}
