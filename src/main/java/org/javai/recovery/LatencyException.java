package org.javai.recovery;

/**
 * Raised in place of an attempt when the time spent on an operation, excluding recovery
 * waits, exceeds {@link TransientOperationOptions#maximumAllowedLatency()}.
 */
public class LatencyException extends RuntimeException {

    public LatencyException(String message) {
        super(message);
    }
}
