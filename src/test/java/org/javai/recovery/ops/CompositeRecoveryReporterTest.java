package org.javai.recovery.ops;

import org.apache.logging.log4j.Level;
import org.javai.recovery.AggregatedFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeRecoveryReporterTest {

	private CapturingAppender appender;
	private List<String> calls;

	@BeforeEach
	void setUp() {
		appender = CapturingAppender.attachTo(CompositeRecoveryReporter.class.getName());
		calls = new ArrayList<>();
	}

	@AfterEach
	void tearDown() {
		appender.detach();
	}

	@Test
	void fansOutEveryEventToEveryReporter() {
		CompositeRecoveryReporter composite = CompositeRecoveryReporter.of(recording("a"), recording("b"));
		AggregatedFailureException aggregated = new AggregatedFailureException(List.of(new IOException("down")));

		composite.reportRetryAttempt("Op", new IOException("down"), 1, Duration.ofSeconds(1));
		composite.reportRecovered("Op", 2);
		composite.reportRetryExhausted("Op", aggregated, 3);
		composite.reportPermanentFault("Op", aggregated, 1);

		assertThat(calls).containsExactly(
				"a:retry", "b:retry",
				"a:recovered", "b:recovered",
				"a:exhausted", "b:exhausted",
				"a:permanent", "b:permanent");
	}

	@Test
	void failingReporter_isLoggedAndDoesNotStopOthers() {
		RecoveryReporter failing = new RecoveryReporter() {
			@Override
			public void reportRecovered(String operation, int totalAttempts) {
				throw new IllegalStateException("webhook unreachable");
			}
		};
		CompositeRecoveryReporter composite = CompositeRecoveryReporter.of(failing, recording("ok"));

		composite.reportRecovered("Op", 2);

		assertThat(calls).containsExactly("ok:recovered");
		assertThat(appender.events()).singleElement().satisfies(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getMessage().getFormattedMessage()).startsWith("RecoveryReporter.reportRecovered failed for");
			assertThat(event.getThrown()).hasMessage("webhook unreachable");
		});
	}

	@Test
	void builder_skipsNullAndConditionalReporters() {
		CompositeRecoveryReporter composite = CompositeRecoveryReporter.builder()
				.add(recording("a"))
				.add(null)
				.addIf(false, recording("skipped"))
				.addIf(true, recording("b"))
				.addAll(List.of(recording("c")))
				.build();

		composite.reportRecovered("Op", 2);

		assertThat(composite.size()).isEqualTo(3);
		assertThat(calls).containsExactly("a:recovered", "b:recovered", "c:recovered");
	}

	@Test
	void composite_viaInterfaceFactory() {
		RecoveryReporter reporter = RecoveryReporter.composite(recording("x"), RecoveryReporter.noOp());

		reporter.reportRecovered("Op", 2);

		assertThat(reporter).isInstanceOf(CompositeRecoveryReporter.class);
		assertThat(calls).containsExactly("x:recovered");
	}

	private RecoveryReporter recording(String name) {
		return new RecoveryReporter() {
			@Override
			public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration waitTime) {
				calls.add(name + ":retry");
			}

			@Override
			public void reportRecovered(String operation, int totalAttempts) {
				calls.add(name + ":recovered");
			}

			@Override
			public void reportRetryExhausted(String operation, AggregatedFailureException failure, int totalAttempts) {
				calls.add(name + ":exhausted");
			}

			@Override
			public void reportPermanentFault(String operation, AggregatedFailureException failure, int totalAttempts) {
				calls.add(name + ":permanent");
			}
		};
	}
}
