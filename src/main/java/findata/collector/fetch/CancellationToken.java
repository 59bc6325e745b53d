package findata.collector.fetch;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal owned by a job loop.
 * Loops poll it only while waiting (interval and backoff), never mid-request.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /** A fresh token that nobody will cancel; used by on-demand runs. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Wait up to {@code duration} for cancellation.
     *
     * @return true if the token was cancelled before the duration elapsed
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
