package org.javai.recovery;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Progress of one engine invocation.
 *
 * @param attempt The current attempt counter (0-based)
 * @param startedAt When the first attempt began
 * @param totalWaitTime Sum of all recovery waits performed so far
 */
record AttemptContext(
        int attempt,
        Instant startedAt,
        Duration totalWaitTime
) {
    AttemptContext {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(totalWaitTime, "totalWaitTime must not be null");
    }

    static AttemptContext first(Instant now) {
        return new AttemptContext(0, now, Duration.ZERO);
    }

    AttemptContext next(Duration waitTime) {
        return new AttemptContext(attempt + 1, startedAt, totalWaitTime.plus(waitTime));
    }

    /**
     * Time spent since the first attempt, not counting recovery waits.
     */
    Duration latency(Instant now) {
        Duration latency = Duration.between(startedAt, now).minus(totalWaitTime);
        return latency.isNegative() ? Duration.ZERO : latency;
    }
}
