package com.vertector.nats.publisher;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Blocking pause between publish attempts. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
