package com.taskgateway.client.http;

import java.time.Duration;

/**
 * Waits between call attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
