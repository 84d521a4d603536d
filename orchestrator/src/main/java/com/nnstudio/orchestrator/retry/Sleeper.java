package com.nnstudio.orchestrator.retry;

/**
 * Suspension point for backoff waits. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
