package io.shepherd.core.working;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Counts job attempts per UTC day and refuses once the limit is exceeded.
 * A limit of zero means unlimited.
 */
final class DailyQuota {

    private final long limit;
    private final Clock clock;

    private LocalDate day;
    private long used;

    DailyQuota(long limit, Clock clock) {
        this.limit = limit;
        this.clock = clock;
    }

    /**
     * Count one attempt against today's quota.
     *
     * @return false if the quota for today is exhausted
     */
    synchronized boolean tryAcquire() {
        if (limit <= 0) {
            return true;
        }
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(day)) {
            day = today;
            used = 0;
        }
        used++;
        return used <= limit;
    }

    synchronized long used() {
        return used;
    }
}
