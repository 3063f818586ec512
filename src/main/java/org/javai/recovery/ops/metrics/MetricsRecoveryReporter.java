package org.javai.recovery.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.recovery.AggregatedFailureException;
import org.javai.recovery.ops.RecoveryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Reports recovery events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object on one line, suitable for metrics aggregation and
 * analysis pipelines. The tracking key is the operation name, prefixed with a
 * configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.FetchQuote","operation":"FetchQuote","attemptNumber":1,"waitTimeMs":200,"failureType":"java.net.SocketTimeoutException","message":"Read timed out"}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jRecoveryReporter pattern:</p>
 * <ul>
 *   <li>{@link #MetricsRecoveryReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsRecoveryReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsRecoveryReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsRecoveryReporter implements RecoveryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.recovery.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRecoveryReporter with no namespace and the default logger.
	 */
	public MetricsRecoveryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRecoveryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRecoveryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRecoveryReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRecoveryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRecoveryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration waitTime) {
		ObjectNode event = event("retry_attempt", operation);
		event.put("attemptNumber", attemptNumber);
		event.put("waitTimeMs", waitTime.toMillis());
		event.put("failureType", failure.getClass().getName());
		event.put("message", failure.getMessage());
		emit(event);
	}

	@Override
	public void reportRecovered(String operation, int totalAttempts) {
		ObjectNode event = event("recovered", operation);
		event.put("totalAttempts", totalAttempts);
		emit(event);
	}

	@Override
	public void reportRetryExhausted(String operation, AggregatedFailureException failure, int totalAttempts) {
		ObjectNode event = terminalEvent("retry_exhausted", operation, failure, totalAttempts);
		failure.diagnostic().ifPresent(diagnostic -> {
			ObjectNode data = event.putObject("diagnostic");
			for (Map.Entry<String, String> entry : diagnostic.data().entrySet()) {
				data.put(entry.getKey(), entry.getValue());
			}
		});
		emit(event);
	}

	@Override
	public void reportPermanentFault(String operation, AggregatedFailureException failure, int totalAttempts) {
		emit(terminalEvent("permanent_fault", operation, failure, totalAttempts));
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode event(String eventType, String operation) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", buildTrackingKey(operation));
		event.put("operation", operation);
		return event;
	}

	private ObjectNode terminalEvent(String eventType, String operation, AggregatedFailureException failure, int totalAttempts) {
		Throwable last = failure.lastFailure();
		ObjectNode event = event(eventType, operation);
		event.put("totalAttempts", totalAttempts);
		event.put("failureCount", failure.failures().size());
		event.put("failureType", last.getClass().getName());
		event.put("message", last.getMessage());
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize {} event", event.path("eventType").asText(), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
