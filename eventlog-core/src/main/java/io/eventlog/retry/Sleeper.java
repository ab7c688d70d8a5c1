package io.eventlog.retry;

/**
 * Blocks the calling thread between retry attempts. Replaceable in tests to observe delays
 * without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     */
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
