package de.bsommerfeld.catalogcrawler.core.util;

/**
 * Blocking pause used for retry backoff and request pacing. Swapped for a
 * recording no-op in tests so they never actually wait.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
