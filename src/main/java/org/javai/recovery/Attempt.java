package org.javai.recovery;

/**
 * One run of the work, whatever its shape. Every public work shape is adapted to this
 * before entering the retry loop.
 */
@FunctionalInterface
interface Attempt<R> {

    R run() throws Exception;
}
