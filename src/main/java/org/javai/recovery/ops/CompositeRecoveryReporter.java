package org.javai.recovery.ops;

import org.javai.recovery.AggregatedFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link RecoveryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is logged at WARN and the remaining reporters still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * RecoveryReporter reporter = CompositeRecoveryReporter.of(
 *     new Log4jRecoveryReporter(),
 *     new MetricsRecoveryReporter("myapp")
 * );
 *
 * // Or using the builder for more control:
 * RecoveryReporter reporter = CompositeRecoveryReporter.builder()
 *     .add(new Log4jRecoveryReporter())
 *     .addIf(metricsEnabled, new MetricsRecoveryReporter("myapp"))
 *     .build();
 * }</pre>
 */
public final class CompositeRecoveryReporter implements RecoveryReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeRecoveryReporter.class);

	private final List<RecoveryReporter> reporters;

	private CompositeRecoveryReporter(List<RecoveryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRecoveryReporter of(RecoveryReporter... reporters) {
		return new CompositeRecoveryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRecoveryReporter of(Collection<? extends RecoveryReporter> reporters) {
		return new CompositeRecoveryReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration waitTime) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(operation, failure, attemptNumber, waitTime));
	}

	@Override
	public void reportRecovered(String operation, int totalAttempts) {
		fanOut("reportRecovered", reporter -> reporter.reportRecovered(operation, totalAttempts));
	}

	@Override
	public void reportRetryExhausted(String operation, AggregatedFailureException failure, int totalAttempts) {
		fanOut("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(operation, failure, totalAttempts));
	}

	@Override
	public void reportPermanentFault(String operation, AggregatedFailureException failure, int totalAttempts) {
		fanOut("reportPermanentFault", reporter -> reporter.reportPermanentFault(operation, failure, totalAttempts));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<RecoveryReporter> call) {
		for (RecoveryReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				LOG.warn("RecoveryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeRecoveryReporter}.
	 */
	public static final class Builder {
		private final List<RecoveryReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null reporters are ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(RecoveryReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends RecoveryReporter> reporters) {
			for (RecoveryReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, RecoveryReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeRecoveryReporter build() {
			return new CompositeRecoveryReporter(reporters);
		}
	}
}
