package org.javai.recovery;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff policy: maps an attempt counter to the time to wait before the next attempt.
 *
 * <p>The engine queries the policy once per attempt, including the first, before the
 * attempt runs. The result is discarded when the attempt succeeds or is the last one,
 * so implementations must be pure.
 */
@FunctionalInterface
public interface RecoveryWaitTime {

    Duration STANDARD_BASE = Duration.ofSeconds(5);
    int STANDARD_EXPONENT_CAP = 5;

    /**
     * @param attempt the zero-based attempt counter
     * @return the time to wait if this attempt fails; never null or negative
     */
    Duration waitTimeFor(int attempt);

    /**
     * Five seconds plus {@code 2^min(attempt, 5)} seconds: 6s, 7s, 9s, 13s, 21s, then 37s for every later attempt.
     */
    static RecoveryWaitTime standard() {
        return attempt -> STANDARD_BASE.plusSeconds(1L << Math.min(attempt, STANDARD_EXPONENT_CAP));
    }

    /**
     * Waits the same time after every failed attempt.
     */
    static RecoveryWaitTime fixed(Duration waitTime) {
        Objects.requireNonNull(waitTime, "waitTime must not be null");
        if (waitTime.isNegative()) {
            throw new IllegalArgumentException("waitTime must not be negative");
        }
        return attempt -> waitTime;
    }

    /**
     * Retries immediately.
     */
    static RecoveryWaitTime none() {
        return fixed(Duration.ZERO);
    }

    /**
     * Waits {@code initial * 2^attempt}, capped at {@code max}.
     */
    static RecoveryWaitTime exponential(Duration initial, Duration max) {
        Objects.requireNonNull(initial, "initial must not be null");
        Objects.requireNonNull(max, "max must not be null");
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("initial and max must not be negative");
        }
        if (initial.compareTo(max) > 0) {
            throw new IllegalArgumentException("initial must not exceed max");
        }
        return attempt -> {
            // Past 2^30 the product only overflows; the cap applies long before.
            long multiplier = 1L << Math.min(attempt, 30);
            Duration waitTime = initial.multipliedBy(multiplier);
            return waitTime.compareTo(max) > 0 ? max : waitTime;
        };
    }
}
