package org.javai.recovery.ops;

import org.javai.recovery.AggregatedFailureException;

import java.time.Duration;

/**
 * Receives recovery events from a {@code TransientOperation} for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporters are called on the thread running the operation, between attempts.
 * A reporter that throws aborts the operation; wrap reporters in a
 * {@link CompositeRecoveryReporter} to isolate them.
 */
public interface RecoveryReporter {

	/**
	 * Reports that an attempt failed transiently and another will follow.
	 *
	 * @param operation The operation name
	 * @param failure The failure raised by the attempt
	 * @param attemptNumber The number of the failed attempt (1-based)
	 * @param waitTime The time the engine will wait before the next attempt
	 */
	default void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration waitTime) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that an operation succeeded after at least one failed attempt.
	 *
	 * @param operation The operation name
	 * @param totalAttempts The total number of attempts made, including the successful one
	 */
	default void reportRecovered(String operation, int totalAttempts) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that retrying stopped on a transient fault, because the retry budget was
	 * spent or the wait was interrupted.
	 *
	 * @param operation The operation name
	 * @param failure The aggregated failure about to be thrown
	 * @param totalAttempts The total number of attempts made
	 */
	default void reportRetryExhausted(String operation, AggregatedFailureException failure, int totalAttempts) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that an attempt failed with a fault classified as permanent.
	 *
	 * @param operation The operation name
	 * @param failure The aggregated failure about to be thrown
	 * @param totalAttempts The total number of attempts made
	 */
	default void reportPermanentFault(String operation, AggregatedFailureException failure, int totalAttempts) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static RecoveryReporter noOp() {
		return new RecoveryReporter() {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static RecoveryReporter composite(RecoveryReporter... reporters) {
		return CompositeRecoveryReporter.of(reporters);
	}
}
