package org.javai.recovery;

/**
 * A fault-sensitive procedure with no return value.
 * Arguments are captured by the lambda or method reference.
 *
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface FaultSensitiveAction<E extends Exception> {

    void run() throws E;
}
