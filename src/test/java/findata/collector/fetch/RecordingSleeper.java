package findata.collector.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Test sleeper that records every requested wait.
 *
 * Waits return immediately unless their duration was marked as blocking, in
 * which case they park until the token is cancelled. Cancellation is always
 * honoured.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Set<Duration> blocking = new HashSet<>();
    private final Duration realDelay;
    private volatile CountDownLatch blockedSignal = new CountDownLatch(1);

    public RecordingSleeper() {
        this(Duration.ZERO);
    }

    /** Every non-blocking wait actually pauses for {@code realDelay}. */
    public RecordingSleeper(Duration realDelay) {
        this.realDelay = realDelay;
    }

    /** Waits of exactly this duration park until cancellation. */
    public synchronized RecordingSleeper blockOn(Duration duration) {
        blocking.add(duration);
        return this;
    }

    @Override
    public boolean sleep(Duration duration, CancellationToken token) throws InterruptedException {
        boolean block;
        synchronized (this) {
            sleeps.add(duration);
            block = blocking.contains(duration);
        }
        if (block) {
            blockedSignal.countDown();
            while (!token.await(Duration.ofSeconds(30))) {
                // keep parking until cancelled
            }
            return false;
        }
        return !token.await(realDelay);
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized long count(Duration duration) {
        return sleeps.stream().filter(duration::equals).count();
    }

    /** Wait until some thread parks in a blocking sleep. */
    public boolean awaitBlocked(long timeout, TimeUnit unit) throws InterruptedException {
        return blockedSignal.await(timeout, unit);
    }
}
