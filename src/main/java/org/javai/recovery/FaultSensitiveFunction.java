package org.javai.recovery;

/**
 * A fault-sensitive function returning a single result.
 *
 * @param <T> The type of value returned
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface FaultSensitiveFunction<T, E extends Exception> {

    T get() throws E;
}
