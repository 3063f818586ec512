package org.javai.recovery.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.recovery.AggregatedFailureException;
import org.javai.recovery.TransientFaultException;
import org.javai.recovery.ops.CapturingAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsRecoveryReporterTest {

	private static final String LOGGER_NAME = "test.recovery.metrics";
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private final ObjectMapper mapper = new ObjectMapper();
	private CapturingAppender appender;
	private MetricsRecoveryReporter reporter;

	@BeforeEach
	void setUp() {
		appender = CapturingAppender.attachTo(LOGGER_NAME);
		reporter = new MetricsRecoveryReporter(null, LoggerFactory.getLogger(LOGGER_NAME), CLOCK);
	}

	@AfterEach
	void tearDown() {
		appender.detach();
	}

	@Test
	void reportRetryAttempt_emitsJsonLine() throws IOException {
		reporter.reportRetryAttempt("order.fetch", new ConnectException("Connection refused"), 1, Duration.ofMillis(200));

		String line = singleLine();
		assertThat(line).doesNotContain("\n");
		JsonNode json = mapper.readTree(line);
		assertThat(json.get("eventType").asText()).isEqualTo("retry_attempt");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("order.fetch");
		assertThat(json.get("attemptNumber").asInt()).isEqualTo(1);
		assertThat(json.get("waitTimeMs").asLong()).isEqualTo(200);
		assertThat(json.get("failureType").asText()).isEqualTo("java.net.ConnectException");
		assertThat(json.get("message").asText()).isEqualTo("Connection refused");
	}

	@Test
	void namespace_prependsToTrackingKey() throws IOException {
		MetricsRecoveryReporter namespaced = new MetricsRecoveryReporter(" myapp ", LoggerFactory.getLogger(LOGGER_NAME), CLOCK);

		namespaced.reportRecovered("order.fetch", 2);

		JsonNode json = mapper.readTree(singleLine());
		assertThat(json.get("trackingKey").asText()).isEqualTo("myapp.order.fetch");
		assertThat(json.get("totalAttempts").asInt()).isEqualTo(2);
	}

	@Test
	void blankNamespace_usesOperationOnly() {
		MetricsRecoveryReporter blank = new MetricsRecoveryReporter("  ", LoggerFactory.getLogger(LOGGER_NAME), CLOCK);

		assertThat(blank.buildTrackingKey("order.fetch")).isEqualTo("order.fetch");
	}

	@Test
	void reportRetryExhausted_includesDiagnosticData() throws IOException {
		Map<String, String> data = new LinkedHashMap<>();
		data.put(TransientFaultException.ATTEMPTS, "2");
		data.put(TransientFaultException.TOTAL_RECOVERY_WAIT_TIME_IN_SECONDS, "0.4");
		TransientFaultException diagnostic = new TransientFaultException(
				"The amount of retry attempts has been reached.", true, data);
		AggregatedFailureException aggregated = new AggregatedFailureException(diagnostic,
				List.of(new IOException("quote \"service\" down"), new IOException("down")));

		reporter.reportRetryExhausted("quotes", aggregated, 3);

		JsonNode json = mapper.readTree(singleLine());
		assertThat(json.get("eventType").asText()).isEqualTo("retry_exhausted");
		assertThat(json.get("totalAttempts").asInt()).isEqualTo(3);
		assertThat(json.get("failureCount").asInt()).isEqualTo(3);
		assertThat(json.get("message").asText()).isEqualTo("quote \"service\" down");
		assertThat(json.get("diagnostic").get("Attempts").asText()).isEqualTo("2");
		assertThat(json.get("diagnostic").get("TotalRecoveryWaitTimeInSeconds").asText()).isEqualTo("0.4");
	}

	@Test
	void reportPermanentFault_hasNoDiagnostic() throws IOException {
		AggregatedFailureException aggregated = new AggregatedFailureException(
				List.of(new IllegalStateException("misconfigured")));

		reporter.reportPermanentFault("quotes", aggregated, 1);

		JsonNode json = mapper.readTree(singleLine());
		assertThat(json.get("eventType").asText()).isEqualTo("permanent_fault");
		assertThat(json.get("failureType").asText()).isEqualTo("java.lang.IllegalStateException");
		assertThat(json.has("diagnostic")).isFalse();
	}

	private String singleLine() {
		assertThat(appender.messages()).hasSize(1);
		return appender.messages().get(0);
	}
}
