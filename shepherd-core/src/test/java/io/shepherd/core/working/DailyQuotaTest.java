package io.shepherd.core.working;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DailyQuotaTest {

    @Test
    void zeroLimitShouldBeUnlimited() {
        var quota = new DailyQuota(0, Clock.systemUTC());

        for (int i = 0; i < 1_000; i++) {
            assertThat(quota.tryAcquire()).isTrue();
        }
    }

    @Test
    void shouldRefuseOnceLimitIsReached() {
        var quota = new DailyQuota(2, Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

        assertThat(quota.tryAcquire()).isTrue();
        assertThat(quota.tryAcquire()).isTrue();
        assertThat(quota.tryAcquire()).isFalse();
        assertThat(quota.used()).isEqualTo(3);
    }

    @Test
    void shouldResetOnNextUtcDay() {
        var clock = new MutableClock(Instant.parse("2024-05-01T23:59:00Z"));
        var quota = new DailyQuota(1, clock);

        assertThat(quota.tryAcquire()).isTrue();
        assertThat(quota.tryAcquire()).isFalse();

        clock.advance(Duration.ofMinutes(2));

        assertThat(quota.tryAcquire()).isTrue();
        assertThat(quota.used()).isEqualTo(1);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
