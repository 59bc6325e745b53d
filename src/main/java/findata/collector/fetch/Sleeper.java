package findata.collector.fetch;

import java.time.Duration;

/**
 * Suspension point used for backoff and interval waits.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Wait for {@code duration} unless {@code token} is cancelled first.
     *
     * @return true if the full duration elapsed, false if cancelled
     */
    boolean sleep(Duration duration, CancellationToken token) throws InterruptedException;

    /** Real waiting, woken early by cancellation. */
    static Sleeper cancellable() {
        return (duration, token) -> !token.await(duration);
    }
}
