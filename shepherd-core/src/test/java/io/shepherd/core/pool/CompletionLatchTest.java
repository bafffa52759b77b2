package io.shepherd.core.pool;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionLatchTest {

    @Test
    void awaitShouldReturnImmediatelyWhenNothingIsPending() throws Exception {
        var latch = new CompletionLatch();

        latch.await();
        assertThat(latch.await(Duration.ofMillis(1))).isTrue();
    }

    @Test
    void awaitShouldBlockUntilAllUnitsAreDone() throws Exception {
        var latch = new CompletionLatch();
        latch.add(2);
        var released = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                latch.await();
                released.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        latch.done();
        assertThat(released.await(100, TimeUnit.MILLISECONDS)).isFalse();

        latch.done();
        assertThat(released.await(5, TimeUnit.SECONDS)).isTrue();
        waiter.join(1000);
    }

    @Test
    void timedAwaitShouldReturnFalseWhenWorkIsOutstanding() throws Exception {
        var latch = new CompletionLatch();
        latch.add(1);

        assertThat(latch.await(Duration.ofMillis(50))).isFalse();
        assertThat(latch.pending()).isEqualTo(1);
    }

    @Test
    void shouldAllowReuseAfterDraining() throws Exception {
        var latch = new CompletionLatch();
        latch.add(1);
        latch.done();
        latch.add(1);

        assertThat(latch.await(Duration.ofMillis(20))).isFalse();
        latch.done();
        assertThat(latch.await(Duration.ofMillis(20))).isTrue();
    }

    @Test
    void shouldRejectNegativeCount() {
        var latch = new CompletionLatch();

        assertThatThrownBy(latch::done)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("negative");
        assertThat(latch.pending()).isZero();
    }

    @Test
    void guardedTrackerShouldDecrementOnlyOnce() {
        var latch = new CompletionLatch();
        latch.add(2);
        var tracker = new GuardedTracker("A", latch, t -> { });

        tracker.done();
        tracker.done();

        assertThat(tracker.signalled()).isTrue();
        assertThat(latch.pending()).isEqualTo(1);
    }
}
