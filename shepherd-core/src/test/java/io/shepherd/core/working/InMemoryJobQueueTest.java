package io.shepherd.core.working;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobQueueTest {

    private final InMemoryJobQueue queue = new InMemoryJobQueue();

    @Test
    void shouldServePendingJobsOldestFirst() throws Exception {
        queue.push("a");
        queue.push("b");

        assertThat(queue.moveToRunning(Duration.ofMillis(10))).contains("a");
        assertThat(queue.moveToRunning(Duration.ofMillis(10))).contains("b");
        assertThat(queue.pendingSize()).isZero();
        assertThat(queue.runningSize()).isEqualTo(2);
    }

    @Test
    void moveToRunningShouldTimeOutOnEmptyQueue() throws Exception {
        long start = System.nanoTime();

        Optional<String> next = queue.moveToRunning(Duration.ofMillis(50));

        assertThat(next).isEmpty();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40);
    }

    @Test
    void moveToRunningShouldWakeWhenJobIsPushed() throws Exception {
        CompletableFuture<Optional<String>> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.moveToRunning(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        });

        queue.push("late");

        assertThat(waiting.get(5, TimeUnit.SECONDS)).contains("late");
    }

    @Test
    void removeFromRunningShouldReportMissingPayload() throws Exception {
        queue.push("a");
        queue.moveToRunning(Duration.ofMillis(10));

        assertThat(queue.removeFromRunning("a")).isTrue();
        assertThat(queue.removeFromRunning("a")).isFalse();
    }

    @Test
    void requeueRunningShouldMoveEverythingBackToPending() throws Exception {
        queue.push("a");
        queue.push("b");
        queue.moveToRunning(Duration.ofMillis(10));
        queue.moveToRunning(Duration.ofMillis(10));

        queue.push("c");

        assertThat(queue.requeueRunning()).isEqualTo(2);
        assertThat(queue.runningSize()).isZero();
        assertThat(queue.pendingJobs()).containsExactly("c", "a", "b");
        assertThat(queue.requeueRunning()).isZero();
    }

    @Test
    void deadLettersShouldBeASnapshot() {
        queue.deadLetter("x");
        var snapshot = queue.deadLetters();
        queue.deadLetter("y");

        assertThat(snapshot).containsExactly("x");
        assertThat(queue.deadLetters()).containsExactly("x", "y");
    }
}
