package findata.collector.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Polling helper for tests that observe background loops.
 */
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
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted while waiting for " + description);
            }
        }
        if (!condition.getAsBoolean()) {
            fail("timed out after " + timeout.toMillis() + "ms waiting for " + description);
        }
    }

    public static void until(BooleanSupplier condition, String description) {
        until(condition, Duration.ofSeconds(5), description);
    }
}
