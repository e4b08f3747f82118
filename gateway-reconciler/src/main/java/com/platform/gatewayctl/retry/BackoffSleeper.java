package com.platform.gatewayctl.retry;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {
    
    BackoffSleeper THREAD_SLEEP = Thread::sleep;
    
    void sleep(long millis) throws InterruptedException;
}
