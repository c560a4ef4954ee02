package com.autocoin.util;

import java.time.Duration;

/**
 * Blocking pause used by retry loops and the rate limiter, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
