package com.firesim.core.generation;

/**
 * Blocking pause between retry attempts. Replaced in tests to observe backoff without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
