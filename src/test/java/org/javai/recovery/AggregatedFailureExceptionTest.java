package org.javai.recovery;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AggregatedFailureExceptionTest {

    @Test
    void causeIsNewestFailure() {
        IOException newest = new IOException("newest");
        IOException oldest = new IOException("oldest");

        AggregatedFailureException aggregated = new AggregatedFailureException(List.of(newest, oldest));

        assertThat(aggregated).hasMessage("One or more errors occurred.");
        assertThat(aggregated.getCause()).isSameAs(newest);
        assertThat(aggregated.failures()).containsExactly(newest, oldest);
    }

    @Test
    void failures_isImmutableSnapshot() {
        List<Throwable> source = new ArrayList<>(List.of(new IOException("one")));
        AggregatedFailureException aggregated = new AggregatedFailureException(source);

        source.add(new IOException("two"));

        assertThat(aggregated.failures()).hasSize(1);
        assertThatThrownBy(() -> aggregated.failures().add(new IOException("three")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsEmptyFailures() {
        assertThatThrownBy(() -> new AggregatedFailureException(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("failures must not be empty");
    }

    @Test
    void diagnostic_presentOnlyWhenGivenExplicitly() {
        TransientFaultException diagnostic = TransientFaultException.retriesExhausted(
                1, Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ZERO);
        IOException failure = new IOException("down");

        AggregatedFailureException exhausted = new AggregatedFailureException(diagnostic, List.of(failure));
        AggregatedFailureException permanent = new AggregatedFailureException(List.of(failure));

        assertThat(exhausted.failures()).containsExactly(diagnostic, failure);
        assertThat(exhausted.getCause()).isSameAs(diagnostic);
        assertThat(exhausted.diagnostic()).contains(diagnostic);
        assertThat(exhausted.retriesExhausted()).isTrue();
        assertThat(exhausted.lastFailure()).isSameAs(failure);
        assertThat(permanent.diagnostic()).isEmpty();
        assertThat(permanent.retriesExhausted()).isFalse();
        assertThat(permanent.lastFailure()).isSameAs(failure);
    }

    @Test
    void transientFaultFromWork_isNotTreatedAsDiagnostic() {
        TransientFaultException upstream = new TransientFaultException(
                "upstream", true, Map.of(TransientFaultException.ATTEMPTS, "4"));
        IOException first = new IOException("first");

        AggregatedFailureException aggregated = new AggregatedFailureException(List.of(upstream, first));

        assertThat(aggregated.diagnostic()).isEmpty();
        assertThat(aggregated.retriesExhausted()).isFalse();
        assertThat(aggregated.lastFailure()).isSameAs(upstream);
    }

    @Test
    void rejectsNullDiagnostic() {
        assertThatThrownBy(() -> new AggregatedFailureException((TransientFaultException) null, List.of(new IOException("down"))))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("diagnostic must not be null");
    }

    @Test
    void toString_listsInnerFailures() {
        AggregatedFailureException aggregated = new AggregatedFailureException(
                List.of(new IOException("second"), new IllegalStateException("first")));

        assertThat(aggregated.toString())
                .contains("(Inner failure 0) java.io.IOException: second")
                .contains("(Inner failure 1) java.lang.IllegalStateException: first");
    }
}
