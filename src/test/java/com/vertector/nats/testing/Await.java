package com.vertector.nats.testing;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/** Polls a condition until it holds or the timeout elapses. */
public final class Await {

    private Await() {
    }

    public static void until(BooleanSupplier condition, Duration timeout, String description) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for: " + description);
            }
        }
        if (!condition.getAsBoolean()) {
            fail("Timed out after " + timeout.toMillis() + " ms waiting for: " + description);
        }
    }

    public static void until(BooleanSupplier condition, String description) {
        until(condition, Duration.ofSeconds(5), description);
    }
}
