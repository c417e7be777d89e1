package net.scanward.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** Delay before attempt {@code attempt + 1}; {@code attempt} starts at 1. */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** base, 2*base, 4*base ... capped at {@code max} */
    static RetryPolicy exponential(Duration base, Duration max) {
        return attempt -> {
            long shift = Math.min(Math.max(attempt - 1, 0), 20);
            Duration d = base.multipliedBy(1L << shift);
            return d.compareTo(max) > 0 ? max : d;
        };
    }
}
