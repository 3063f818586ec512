package org.javai.recovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown by {@link TransientOperation} when a fault-sensitive operation could not be
 * completed with recovery enabled.
 *
 * <p>The failures are ordered newest-first. When the engine stopped retrying on a
 * transient fault, the first entry is its synthetic {@link TransientFaultException}
 * diagnostic and every failure raised by the work follows in reverse chronological
 * order. When a failure was classified as permanent, only the failures actually raised
 * by the work are present. A {@code TransientFaultException} thrown by the work itself
 * is an ordinary failure and never counts as the diagnostic.
 *
 * <p>The cause of this exception is always the newest entry.
 */
public class AggregatedFailureException extends RuntimeException {

    static final String DEFAULT_MESSAGE = "One or more errors occurred.";

    private final List<Throwable> failures;
    private final TransientFaultException diagnostic;

    /**
     * Aggregates failures raised by the work, without an engine diagnostic.
     */
    public AggregatedFailureException(List<? extends Throwable> failures) {
        this(DEFAULT_MESSAGE, failures);
    }

    public AggregatedFailureException(String message, List<? extends Throwable> failures) {
        this(message, null, failures);
    }

    /**
     * Aggregates failures raised by the work behind the engine's diagnostic.
     *
     * @param diagnostic  the diagnostic describing the retry effort, placed first
     * @param failures    the work's failures, newest-first
     */
    public AggregatedFailureException(TransientFaultException diagnostic, List<? extends Throwable> failures) {
        this(DEFAULT_MESSAGE, Objects.requireNonNull(diagnostic, "diagnostic must not be null"), failures);
    }

    private AggregatedFailureException(String message, TransientFaultException diagnostic,
                                       List<? extends Throwable> failures) {
        super(message, newest(diagnostic, failures));
        this.failures = entries(diagnostic, failures);
        this.diagnostic = diagnostic;
    }

    private static Throwable newest(TransientFaultException diagnostic, List<? extends Throwable> failures) {
        Objects.requireNonNull(failures, "failures must not be null");
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("failures must not be empty");
        }
        return diagnostic != null ? diagnostic : failures.get(0);
    }

    private static List<Throwable> entries(TransientFaultException diagnostic, List<? extends Throwable> failures) {
        if (diagnostic == null) {
            return List.copyOf(failures);
        }
        List<Throwable> entries = new ArrayList<>(failures.size() + 1);
        entries.add(diagnostic);
        entries.addAll(failures);
        return List.copyOf(entries);
    }

    /**
     * Returns every failure recorded during the invocation, newest-first.
     */
    public List<Throwable> failures() {
        return failures;
    }

    /**
     * Returns the engine diagnostic, present when retrying stopped on a transient fault.
     */
    public Optional<TransientFaultException> diagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    /**
     * True when the retry budget was used up on a transient fault.
     */
    public boolean retriesExhausted() {
        return diagnostic != null && diagnostic.retriesExhausted();
    }

    /**
     * Returns the most recent failure raised by the work itself, skipping the diagnostic.
     */
    public Throwable lastFailure() {
        return diagnostic != null ? failures.get(1) : failures.get(0);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(super.toString());
        for (int i = 0; i < failures.size(); i++) {
            builder.append(System.lineSeparator())
                    .append(" --> (Inner failure ").append(i).append(") ")
                    .append(failures.get(i));
        }
        return builder.toString();
    }
}
