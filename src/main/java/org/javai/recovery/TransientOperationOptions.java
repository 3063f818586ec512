package org.javai.recovery;

import org.javai.recovery.classify.DefaultTransientFaultClassifier;
import org.javai.recovery.classify.TransientFaultClassifier;

import java.time.Duration;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Immutable configuration of a {@link TransientOperation}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TransientOperationOptions options = TransientOperationOptions.builder()
 *     .retryAttempts(3)
 *     .recoveryWaitTime(RecoveryWaitTime.exponential(Duration.ofMillis(100), Duration.ofSeconds(2)))
 *     .transientFaultClassifier(TransientFaultClassifier.of(IOException.class))
 *     .build();
 * }</pre>
 *
 * @param enableRecovery When false, the work runs exactly once and failures propagate unchanged
 * @param retryAttempts Maximum number of retries after the first attempt
 * @param recoveryWaitTime Backoff policy, queried once per attempt
 * @param transientFaultClassifier Decides whether a failure may be retried
 * @param maximumAllowedLatency Upper bound on time spent outside of recovery waits, or null for none
 */
public record TransientOperationOptions(
        boolean enableRecovery,
        int retryAttempts,
        RecoveryWaitTime recoveryWaitTime,
        TransientFaultClassifier transientFaultClassifier,
        Duration maximumAllowedLatency
) {

    public static final int DEFAULT_RETRY_ATTEMPTS = 5;

    static final String ENABLED_PROPERTY = "javai.recovery.enabled";
    static final String ENABLED_ENV = "JAVAI_RECOVERY_ENABLED";
    static final String RETRY_ATTEMPTS_PROPERTY = "javai.recovery.retryAttempts";
    static final String RETRY_ATTEMPTS_ENV = "JAVAI_RECOVERY_RETRY_ATTEMPTS";
    static final String WAIT_TIME_PROPERTY = "javai.recovery.waitTime";
    static final String WAIT_TIME_ENV = "JAVAI_RECOVERY_WAIT_TIME";
    static final String MAX_LATENCY_PROPERTY = "javai.recovery.maxLatency";
    static final String MAX_LATENCY_ENV = "JAVAI_RECOVERY_MAX_LATENCY";

    public TransientOperationOptions {
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must be >= 0, was: " + retryAttempts);
        }
        Objects.requireNonNull(recoveryWaitTime, "recoveryWaitTime must not be null");
        Objects.requireNonNull(transientFaultClassifier, "transientFaultClassifier must not be null");
        if (maximumAllowedLatency != null && (maximumAllowedLatency.isNegative() || maximumAllowedLatency.isZero())) {
            throw new IllegalArgumentException("maximumAllowedLatency must be positive, was: " + maximumAllowedLatency);
        }
    }

    /**
     * Recovery enabled, five retries, the standard backoff and the default classifier.
     */
    public static TransientOperationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enableRecovery(enableRecovery)
                .retryAttempts(retryAttempts)
                .recoveryWaitTime(recoveryWaitTime)
                .transientFaultClassifier(transientFaultClassifier)
                .maximumAllowedLatency(maximumAllowedLatency);
    }

    /**
     * Builds options from system properties and environment variables, system properties first.
     *
     * <table>
     *   <caption>Configuration keys</caption>
     *   <tr><td>{@value #ENABLED_PROPERTY}</td><td>{@value #ENABLED_ENV}</td><td>true or false</td></tr>
     *   <tr><td>{@value #RETRY_ATTEMPTS_PROPERTY}</td><td>{@value #RETRY_ATTEMPTS_ENV}</td><td>integer &gt;= 0</td></tr>
     *   <tr><td>{@value #WAIT_TIME_PROPERTY}</td><td>{@value #WAIT_TIME_ENV}</td><td>ISO-8601 duration, fixed backoff</td></tr>
     *   <tr><td>{@value #MAX_LATENCY_PROPERTY}</td><td>{@value #MAX_LATENCY_ENV}</td><td>ISO-8601 duration</td></tr>
     * </table>
     *
     * <p>Keys that are not set keep their defaults.
     *
     * @throws IllegalStateException if a value cannot be parsed
     * @throws IllegalArgumentException if a parsed value is out of range
     */
    public static TransientOperationOptions fromEnvironment() {
        return fromEnvironment(ConfigResolver.system());
    }

    static TransientOperationOptions fromEnvironment(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        return fromEnvironment(new ConfigResolver(properties, environment));
    }

    private static TransientOperationOptions fromEnvironment(ConfigResolver config) {
        Builder builder = builder();
        config.resolveBoolean(ENABLED_PROPERTY, ENABLED_ENV).ifPresent(builder::enableRecovery);
        config.resolveInt(RETRY_ATTEMPTS_PROPERTY, RETRY_ATTEMPTS_ENV).ifPresent(builder::retryAttempts);
        config.resolveDuration(WAIT_TIME_PROPERTY, WAIT_TIME_ENV)
                .map(RecoveryWaitTime::fixed)
                .ifPresent(builder::recoveryWaitTime);
        config.resolveDuration(MAX_LATENCY_PROPERTY, MAX_LATENCY_ENV).ifPresent(builder::maximumAllowedLatency);
        return builder.build();
    }

    /**
     * Builder for {@link TransientOperationOptions}. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private boolean enableRecovery = true;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private RecoveryWaitTime recoveryWaitTime = RecoveryWaitTime.standard();
        private TransientFaultClassifier transientFaultClassifier = DefaultTransientFaultClassifier.INSTANCE;
        private Duration maximumAllowedLatency;

        private Builder() {}

        public Builder enableRecovery(boolean enableRecovery) {
            this.enableRecovery = enableRecovery;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder recoveryWaitTime(RecoveryWaitTime recoveryWaitTime) {
            this.recoveryWaitTime = recoveryWaitTime;
            return this;
        }

        public Builder transientFaultClassifier(TransientFaultClassifier transientFaultClassifier) {
            this.transientFaultClassifier = transientFaultClassifier;
            return this;
        }

        /**
         * Sets the latency bound (optional, null means unbounded).
         */
        public Builder maximumAllowedLatency(Duration maximumAllowedLatency) {
            this.maximumAllowedLatency = maximumAllowedLatency;
            return this;
        }

        /**
         * @throws IllegalArgumentException if retryAttempts is negative or the latency bound is not positive
         * @throws NullPointerException if a callback is null
         */
        public TransientOperationOptions build() {
            return new TransientOperationOptions(
                    enableRecovery,
                    retryAttempts,
                    recoveryWaitTime,
                    transientFaultClassifier,
                    maximumAllowedLatency
            );
        }
    }
}
