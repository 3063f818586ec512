package org.javai.recovery;

import java.time.Duration;
import java.util.Objects;

/**
 * What the engine does after a failed attempt.
 */
sealed interface RecoveryDecision permits RecoveryDecision.Retry, RecoveryDecision.GiveUp {

    /**
     * Wait for the given time, then attempt again.
     */
    record Retry(Duration waitTime) implements RecoveryDecision {
        public Retry {
            Objects.requireNonNull(waitTime, "waitTime must not be null");
            if (waitTime.isNegative()) {
                throw new IllegalArgumentException("waitTime must not be negative");
            }
        }

        static Retry after(Duration waitTime) {
            return new Retry(waitTime);
        }
    }

    /**
     * Stop and propagate the aggregated failure.
     *
     * @param retriesExhausted true when the failure was transient but the budget is spent,
     *                         false when the failure was permanent
     */
    record GiveUp(boolean retriesExhausted) implements RecoveryDecision {

        static GiveUp exhausted() {
            return new GiveUp(true);
        }

        static GiveUp permanent() {
            return new GiveUp(false);
        }
    }
}
