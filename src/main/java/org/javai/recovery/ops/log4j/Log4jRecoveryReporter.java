package org.javai.recovery.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.recovery.AggregatedFailureException;
import org.javai.recovery.TransientFaultException;
import org.javai.recovery.ops.RecoveryReporter;

import java.time.Duration;

/**
 * Reports recovery events using Log4j2.
 *
 * <p>Levels by event:
 * <ul>
 *   <li>retry attempt → INFO</li>
 *   <li>recovered → INFO</li>
 *   <li>retries exhausted → WARN</li>
 *   <li>permanent fault → ERROR</li>
 * </ul>
 *
 * <p>Each event carries its own marker so that appenders can route or filter them.
 * The two terminal events carry the aggregated failure as the logged throwable.
 */
public class Log4jRecoveryReporter implements RecoveryReporter {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RECOVERED_MARKER = MarkerManager.getMarker("RECOVERED");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker PERMANENT_FAULT_MARKER = MarkerManager.getMarker("PERMANENT_FAULT");

	static final String DEFAULT_LOGGER_NAME = "org.javai.recovery.RecoveryReporter";

	private final Logger logger;

	/**
	 * Creates a Log4jRecoveryReporter using the default logger name.
	 */
	public Log4jRecoveryReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a Log4jRecoveryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRecoveryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRecoveryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRecoveryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration waitTime) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] failed with {}: {}. Retrying in {} seconds",
				attemptNumber,
				operation,
				failure.getClass().getName(),
				failure.getMessage(),
				TransientFaultException.seconds(waitTime));
	}

	@Override
	public void reportRecovered(String operation, int totalAttempts) {
		logger.atInfo()
			.withMarker(RECOVERED_MARKER)
			.log("Operation [{}] recovered after {} attempts", operation, totalAttempts);
	}

	@Override
	public void reportRetryExhausted(String operation, AggregatedFailureException failure, int totalAttempts) {
		Throwable last = failure.lastFailure();
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.withThrowable(failure)
			.log("Retry exhausted for operation [{}] after {} attempts. Last failure: {}: {}",
				operation,
				totalAttempts,
				last.getClass().getName(),
				last.getMessage());
	}

	@Override
	public void reportPermanentFault(String operation, AggregatedFailureException failure, int totalAttempts) {
		Throwable last = failure.lastFailure();
		logger.atError()
			.withMarker(PERMANENT_FAULT_MARKER)
			.withThrowable(failure)
			.log("Permanent fault in operation [{}] on attempt {}: {}: {}",
				operation,
				totalAttempts,
				last.getClass().getName(),
				last.getMessage());
	}
}
