package org.javai.recovery;

import org.javai.recovery.ops.RecoveryReporter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs fault-sensitive work again and again until it succeeds, the retry budget is spent,
 * or a failure is classified as permanent.
 *
 * <p>With recovery enabled, every failure raised by the work is collected newest-first and
 * surfaced as one {@link AggregatedFailureException}. When the last failure was still
 * transient, a {@link TransientFaultException} describing the retry effort is placed in
 * front of it. With recovery disabled, the work runs once and its failure propagates
 * unchanged, which is the only way the checked exception type {@code E} can escape.
 *
 * <p>Instances are immutable and may be shared between threads. Each invocation keeps its
 * own state and blocks the calling thread while waiting between attempts.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TransientOperation operation = TransientOperation.builder()
 *     .options(TransientOperationOptions.builder()
 *         .retryAttempts(3)
 *         .recoveryWaitTime(RecoveryWaitTime.fixed(Duration.ofMillis(200)))
 *         .build())
 *     .reporter(new Log4jRecoveryReporter())
 *     .build();
 *
 * Quote quote = operation.withFunction("FetchQuote", () -> quoteClient.fetch(symbol));
 * }</pre>
 */
public final class TransientOperation {

    static final String DEFAULT_OPERATION = "TransientOperation";

    private static final Consumer<Exception> NOTHING_TO_RELEASE = failure -> {};

    private final TransientOperationOptions options;
    private final RecoveryReporter reporter;
    private final Sleeper sleeper;
    private final Clock clock;

    private TransientOperation(TransientOperationOptions options, RecoveryReporter reporter, Sleeper sleeper, Clock clock) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An engine with {@link TransientOperationOptions#defaults()} and no reporting.
     */
    public static TransientOperation withDefaults() {
        return builder().build();
    }

    public static TransientOperation of(TransientOperationOptions options) {
        return builder().options(options).build();
    }

    public TransientOperationOptions options() {
        return options;
    }

    /**
     * Builder for configuring a TransientOperation instance.
     */
    public static final class Builder {
        private TransientOperationOptions options = TransientOperationOptions.defaults();
        private RecoveryReporter reporter = RecoveryReporter.noOp();
        private Sleeper sleeper = Sleeper.THREAD;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the options (optional, defaults to {@link TransientOperationOptions#defaults()}).
         *
         * @param options the options to use
         * @return this builder
         */
        public Builder options(TransientOperationOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        /**
         * Sets the reporter for recovery events (optional, defaults to no-op).
         *
         * @param reporter the reporter for recovery events
         * @return this builder
         */
        public Builder reporter(RecoveryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets the clock used by the latency guard for testing (package-private).
         */
        Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public TransientOperation build() {
            return new TransientOperation(options, reporter, sleeper, clock);
        }
    }

    // === WORK SHAPES ===

    /**
     * Runs a procedure under the recovery loop.
     *
     * @throws AggregatedFailureException if recovery is enabled and the work could not complete
     * @throws E if recovery is disabled and the work fails
     */
    public <E extends Exception> void withAction(FaultSensitiveAction<E> work) throws E {
        withAction(DEFAULT_OPERATION, work);
    }

    /**
     * Runs a procedure under the recovery loop, naming it for reporting.
     */
    public <E extends Exception> void withAction(String operation, FaultSensitiveAction<E> work) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        if (!options.enableRecovery()) {
            work.run();
            return;
        }
        execute(operation, () -> {
            work.run();
            return null;
        }, NOTHING_TO_RELEASE);
    }

    /**
     * Runs a function under the recovery loop and returns its value.
     *
     * @throws AggregatedFailureException if recovery is enabled and the work could not complete
     * @throws E if recovery is disabled and the work fails
     */
    public <T, E extends Exception> T withFunction(FaultSensitiveFunction<T, E> work) throws E {
        return withFunction(DEFAULT_OPERATION, work);
    }

    /**
     * Runs a function under the recovery loop, naming it for reporting.
     */
    public <T, E extends Exception> T withFunction(String operation, FaultSensitiveFunction<T, E> work) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        if (!options.enableRecovery()) {
            return work.get();
        }
        return execute(operation, work::get, NOTHING_TO_RELEASE);
    }

    /**
     * Runs a tester under the recovery loop. The tester's flag is returned as-is; only a
     * thrown failure leads to another attempt.
     *
     * <p>After each failed attempt the holder is cleared, closing its value first when it
     * is {@link AutoCloseable}.
     *
     * @throws AggregatedFailureException if recovery is enabled and the work could not complete
     * @throws E if recovery is disabled and the work fails
     */
    public <T, E extends Exception> boolean tryWithFunction(FaultSensitiveTester<T, E> work, ResultHolder<T> result) throws E {
        return tryWithFunction(DEFAULT_OPERATION, work, result);
    }

    /**
     * Runs a tester under the recovery loop, naming it for reporting.
     */
    public <T, E extends Exception> boolean tryWithFunction(String operation, FaultSensitiveTester<T, E> work,
                                                            ResultHolder<T> result) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(result, "result must not be null");
        if (!options.enableRecovery()) {
            return work.test(result);
        }
        return execute(operation, () -> work.test(result), failure -> release(result, failure));
    }

    // === STATIC CONVENIENCE METHODS ===

    /**
     * Runs a function with the default options.
     *
     * @throws AggregatedFailureException if the work could not complete
     */
    public static <T> T execute(FaultSensitiveFunction<T, ? extends Exception> work) {
        return execute(TransientOperationOptions.DEFAULT_RETRY_ATTEMPTS, work);
    }

    /**
     * Runs a function with the default options and the given number of retries.
     *
     * @param retryAttempts maximum number of retries after the first attempt (must be >= 0)
     * @throws AggregatedFailureException if the work could not complete
     * @throws IllegalArgumentException if retryAttempts is negative
     */
    public static <T> T execute(int retryAttempts, FaultSensitiveFunction<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        TransientOperation operation = of(TransientOperationOptions.builder()
                .retryAttempts(retryAttempts)
                .build());
        return operation.execute(DEFAULT_OPERATION, work::get, NOTHING_TO_RELEASE);
    }

    // === RECOVERY LOOP ===

    private <R> R execute(String operation, Attempt<R> work, Consumer<Exception> onFailedAttempt) {
        FailureLog failures = new FailureLog();
        AttemptContext context = AttemptContext.first(clock.instant());

        while (true) {
            Duration waitTime = waitTimeFor(context.attempt());
            R result;
            try {
                guardLatency(context);
                result = work.run();
            } catch (Exception failure) {
                if (failure instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                onFailedAttempt.accept(failure);
                failures.prepend(failure);
                context = recover(operation, failures, context, waitTime, failure);
                continue;
            }
            if (context.attempt() > 0) {
                reporter.reportRecovered(operation, context.attempt() + 1);
            }
            return result;
        }
    }

    /**
     * Waits for the next attempt and returns its context, or throws the aggregated failure.
     */
    private AttemptContext recover(String operation, FailureLog failures, AttemptContext context,
                                   Duration waitTime, Exception failure) {
        RecoveryDecision decision = decide(context, waitTime, failure);

        if (decision instanceof RecoveryDecision.GiveUp giveUp) {
            throw giveUp(operation, failures, context, waitTime, giveUp);
        }

        Duration delay = ((RecoveryDecision.Retry) decision).waitTime();
        reporter.reportRetryAttempt(operation, failure, context.attempt() + 1, delay);
        pause(operation, failures, context, delay);
        return context.next(delay);
    }

    private RecoveryDecision decide(AttemptContext context, Duration waitTime, Exception failure) {
        if (!isTransient(failure)) {
            return RecoveryDecision.GiveUp.permanent();
        }
        if (context.attempt() >= options.retryAttempts()) {
            return RecoveryDecision.GiveUp.exhausted();
        }
        return RecoveryDecision.Retry.after(waitTime);
    }

    /**
     * A classifier that throws leaves the failure permanent, carrying the classifier's
     * exception as suppressed.
     */
    private boolean isTransient(Exception failure) {
        try {
            return options.transientFaultClassifier().isTransient(failure);
        } catch (RuntimeException e) {
            if (e != failure) {
                failure.addSuppressed(e);
            }
            return false;
        }
    }

    private AggregatedFailureException giveUp(String operation, FailureLog failures, AttemptContext context,
                                              Duration waitTime, RecoveryDecision.GiveUp giveUp) {
        int invocations = context.attempt() + 1;
        if (!giveUp.retriesExhausted()) {
            AggregatedFailureException aggregated = failures.toAggregatedFailure();
            reporter.reportPermanentFault(operation, aggregated, invocations);
            return aggregated;
        }
        AggregatedFailureException aggregated = failures.toAggregatedFailure(TransientFaultException.retriesExhausted(
                context.attempt(),
                waitTime,
                context.totalWaitTime(),
                context.latency(clock.instant())
        ));
        reporter.reportRetryExhausted(operation, aggregated, invocations);
        return aggregated;
    }

    /**
     * An interrupted wait ends the invocation. The diagnostic counts only the waits that
     * completed before the interruption.
     */
    private void pause(String operation, FailureLog failures, AttemptContext context, Duration waitTime) {
        if (waitTime.isZero()) {
            return;
        }
        try {
            sleeper.sleep(waitTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            int invocations = context.attempt() + 1;
            AggregatedFailureException aggregated = failures.toAggregatedFailure(TransientFaultException.interrupted(
                    invocations,
                    waitTime,
                    context.totalWaitTime(),
                    context.latency(clock.instant()),
                    e
            ));
            reporter.reportRetryExhausted(operation, aggregated, invocations);
            throw aggregated;
        }
    }

    private void guardLatency(AttemptContext context) {
        Duration maximum = options.maximumAllowedLatency();
        if (maximum == null) {
            return;
        }
        Duration latency = context.latency(clock.instant());
        if (latency.compareTo(maximum) > 0) {
            throw new LatencyException(String.format(
                    "The latency of the operation exceeded the allowed maximum value of %s seconds. Actual latency was: %s seconds.",
                    TransientFaultException.seconds(maximum),
                    TransientFaultException.seconds(latency)
            ));
        }
    }

    private Duration waitTimeFor(int attempt) {
        Duration waitTime = options.recoveryWaitTime().waitTimeFor(attempt);
        if (waitTime == null || waitTime.isNegative()) {
            throw new IllegalStateException(
                    "recoveryWaitTime returned an invalid wait time for attempt " + attempt + ": " + waitTime);
        }
        return waitTime;
    }

    private static void release(ResultHolder<?> result, Exception failure) {
        Object partial = result.get();
        result.clear();
        if (partial instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                failure.addSuppressed(e);
            }
        }
    }
}
