package org.javai.recovery;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Newest-first record of the failures seen during one engine invocation.
 * Work may fail from a background thread, so every access is under the log's own lock.
 */
final class FailureLog {

    private final Deque<Throwable> entries = new ArrayDeque<>();

    void prepend(Throwable failure) {
        synchronized (entries) {
            entries.addFirst(failure);
        }
    }

    AggregatedFailureException toAggregatedFailure() {
        synchronized (entries) {
            return new AggregatedFailureException(new ArrayList<>(entries));
        }
    }

    AggregatedFailureException toAggregatedFailure(TransientFaultException diagnostic) {
        synchronized (entries) {
            return new AggregatedFailureException(diagnostic, new ArrayList<>(entries));
        }
    }
}
