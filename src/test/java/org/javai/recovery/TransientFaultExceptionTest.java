package org.javai.recovery;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TransientFaultExceptionTest {

    @Test
    void seconds_rendersPlainDecimal() {
        assertThat(TransientFaultException.seconds(Duration.ZERO)).isEqualTo("0");
        assertThat(TransientFaultException.seconds(Duration.ofMillis(10))).isEqualTo("0.01");
        assertThat(TransientFaultException.seconds(Duration.ofSeconds(30))).isEqualTo("30");
        assertThat(TransientFaultException.seconds(Duration.ofMillis(1500))).isEqualTo("1.5");
        assertThat(TransientFaultException.seconds(Duration.ofNanos(1))).isEqualTo("0.000000001");
    }

    @Test
    void retriesExhausted_carriesMetadataInOrder() {
        TransientFaultException exception = TransientFaultException.retriesExhausted(
                4, Duration.ofSeconds(21), Duration.ofSeconds(35), Duration.ofMillis(250));

        assertThat(exception).hasMessage("The amount of retry attempts has been reached.");
        assertThat(exception.retriesExhausted()).isTrue();
        assertThat(exception.attempts()).isEqualTo(4);
        assertThat(exception.data()).containsExactly(
                entry("Attempts", "4"),
                entry("RecoveryWaitTimeInSeconds", "21"),
                entry("TotalRecoveryWaitTimeInSeconds", "35"),
                entry("LatencyInSeconds", "0.25"));
    }

    @Test
    void interrupted_keepsCauseAndUnhandledMessage() {
        InterruptedException cause = new InterruptedException("stop");

        TransientFaultException exception = TransientFaultException.interrupted(
                2, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ZERO, cause);

        assertThat(exception).hasMessage("An unhandled exception occurred during the execution of the current operation.");
        assertThat(exception.getCause()).isSameAs(cause);
        assertThat(exception.retriesExhausted()).isFalse();
    }

    @Test
    void data_isCopiedAndUnmodifiable() {
        Map<String, String> data = new HashMap<>();
        data.put(TransientFaultException.ATTEMPTS, "1");
        TransientFaultException exception = new TransientFaultException("custom", false, data);

        data.put(TransientFaultException.ATTEMPTS, "2");

        assertThat(exception.attempts()).isEqualTo(1);
        assertThatThrownBy(() -> exception.data().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
