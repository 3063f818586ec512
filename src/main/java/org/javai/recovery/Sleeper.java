package org.javai.recovery;

import java.time.Duration;

/**
 * Blocks the calling thread for a recovery wait. Replaced in tests.
 */
@FunctionalInterface
interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
