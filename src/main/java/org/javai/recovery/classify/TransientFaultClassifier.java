package org.javai.recovery.classify;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a failure is worth another attempt.
 * Implementations must be deterministic and must not throw.
 */
@FunctionalInterface
public interface TransientFaultClassifier {

    /**
     * @param failure the failure raised by the work
     * @return true if the failure is transient and the work may be retried
     */
    boolean isTransient(Throwable failure);

    static TransientFaultClassifier alwaysTransient() {
        return failure -> true;
    }

    static TransientFaultClassifier neverTransient() {
        return failure -> false;
    }

    /**
     * Transient when the failure, or any failure in its cause chain, is an instance of one
     * of the given types.
     */
    @SafeVarargs
    static TransientFaultClassifier of(Class<? extends Throwable>... transientTypes) {
        Objects.requireNonNull(transientTypes, "transientTypes must not be null");
        List<Class<? extends Throwable>> types = List.of(transientTypes);
        return failure -> CauseChain.of(failure).stream()
                .anyMatch(t -> types.stream().anyMatch(type -> type.isInstance(t)));
    }
}
