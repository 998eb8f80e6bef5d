package com.faasrt.worker;

import java.time.Duration;

/**
 * Pause between poll cycles.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
