package org.javai.recovery;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Engine-generated diagnostic summarizing why a transient fault could not be recovered.
 * It never originates from the work itself; {@link TransientOperation} places it at the
 * front of an {@link AggregatedFailureException} when retrying stops while the last
 * failure was still considered transient.
 *
 * <p>The diagnostic carries string-keyed metadata:
 * <ul>
 *   <li>{@value #ATTEMPTS} - the zero-based attempt counter when retrying stopped</li>
 *   <li>{@value #RECOVERY_WAIT_TIME_IN_SECONDS} - the wait time computed for the last attempt</li>
 *   <li>{@value #TOTAL_RECOVERY_WAIT_TIME_IN_SECONDS} - the sum of all waits performed</li>
 *   <li>{@value #LATENCY_IN_SECONDS} - time spent outside of waits since the first attempt</li>
 * </ul>
 */
public class TransientFaultException extends RuntimeException {

    public static final String ATTEMPTS = "Attempts";
    public static final String RECOVERY_WAIT_TIME_IN_SECONDS = "RecoveryWaitTimeInSeconds";
    public static final String TOTAL_RECOVERY_WAIT_TIME_IN_SECONDS = "TotalRecoveryWaitTimeInSeconds";
    public static final String LATENCY_IN_SECONDS = "LatencyInSeconds";

    static final String RETRIES_EXHAUSTED_MESSAGE = "The amount of retry attempts has been reached.";
    static final String UNHANDLED_MESSAGE = "An unhandled exception occurred during the execution of the current operation.";

    private final boolean retriesExhausted;
    private final Map<String, String> data;

    public TransientFaultException(String message, boolean retriesExhausted, Map<String, String> data) {
        this(message, retriesExhausted, data, null);
    }

    public TransientFaultException(String message, boolean retriesExhausted, Map<String, String> data, Throwable cause) {
        super(message, cause);
        Objects.requireNonNull(data, "data must not be null");
        this.retriesExhausted = retriesExhausted;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    static TransientFaultException retriesExhausted(int attempts, Duration lastWaitTime, Duration totalWaitTime, Duration latency) {
        return new TransientFaultException(RETRIES_EXHAUSTED_MESSAGE, true,
                metadata(attempts, lastWaitTime, totalWaitTime, latency));
    }

    static TransientFaultException interrupted(int attempts, Duration lastWaitTime, Duration totalWaitTime, Duration latency,
                                               InterruptedException cause) {
        return new TransientFaultException(UNHANDLED_MESSAGE, false,
                metadata(attempts, lastWaitTime, totalWaitTime, latency), cause);
    }

    private static Map<String, String> metadata(int attempts, Duration lastWaitTime, Duration totalWaitTime, Duration latency) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(ATTEMPTS, String.valueOf(attempts));
        data.put(RECOVERY_WAIT_TIME_IN_SECONDS, seconds(lastWaitTime));
        data.put(TOTAL_RECOVERY_WAIT_TIME_IN_SECONDS, seconds(totalWaitTime));
        data.put(LATENCY_IN_SECONDS, seconds(latency));
        return data;
    }

    /**
     * Renders a duration as plain decimal seconds, e.g. {@code 0.02}, {@code 5} or {@code 0}.
     */
    public static String seconds(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        BigDecimal seconds = BigDecimal.valueOf(duration.getSeconds())
                .add(BigDecimal.valueOf(duration.getNano(), 9));
        return seconds.signum() == 0 ? "0" : seconds.stripTrailingZeros().toPlainString();
    }

    /**
     * True when retrying stopped because the retry budget was used up, false when the
     * retry loop was broken by something else (for example an interrupted wait).
     */
    public boolean retriesExhausted() {
        return retriesExhausted;
    }

    public Map<String, String> data() {
        return data;
    }

    public int attempts() {
        return Integer.parseInt(data.get(ATTEMPTS));
    }
}
