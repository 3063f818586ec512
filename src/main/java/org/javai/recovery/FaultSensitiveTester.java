package org.javai.recovery;

/**
 * A fault-sensitive function that reports success with a flag and hands its result back
 * through a {@link ResultHolder}.
 *
 * <p>The result may be written before the tester fails. If that partial result is
 * {@link AutoCloseable}, the engine closes it before the next attempt or before the
 * failure propagates.
 *
 * @param <T> The type of the out-of-band result
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface FaultSensitiveTester<T, E extends Exception> {

    /**
     * @param result receives the result of the operation
     * @return true if the operation succeeded
     */
    boolean test(ResultHolder<T> result) throws E;
}
