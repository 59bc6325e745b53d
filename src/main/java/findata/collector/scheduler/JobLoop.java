package findata.collector.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import findata.collector.error.JobRunException;
import findata.collector.fetch.CancellationToken;
import findata.collector.fetch.Sleeper;
import findata.collector.model.JobDescriptor;
import findata.collector.service.JobRunner;
import findata.collector.service.JobStatusTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * The scheduled loop of a single job.
 *
 * Runs the job, records the outcome, then waits the job's interval and
 * repeats. The interval wait always follows the status update, so runs of
 * the same job never overlap. Cancellation is only noticed while waiting
 * (here, or in a backoff inside the fetch); a run in progress finishes and
 * records its outcome first.
 */
final class JobLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobLoop.class);

    private final JobDescriptor job;
    private final JobRunner runner;
    private final JobStatusTracker tracker;
    private final Sleeper sleeper;
    private final Clock clock;
    private final CancellationToken token;

    JobLoop(JobDescriptor job, JobRunner runner, JobStatusTracker tracker,
            Sleeper sleeper, Clock clock, CancellationToken token) {
        this.job = job;
        this.runner = runner;
        this.tracker = tracker;
        this.sleeper = sleeper;
        this.clock = clock;
        this.token = token;
    }

    @Override
    public void run() {
        log.debug("Loop for job '{}' entered", job.name());
        try {
            while (!token.isCancelled()) {
                runOnce();
                if (!sleeper.sleep(job.interval(), token)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Loop for job '{}' interrupted", job.name());
        }
        log.info("Job '{}' cancelled", job.name());
    }

    /**
     * One scheduled run. Every failure is recorded and swallowed here so the
     * loop survives to its next interval.
     */
    void runOnce() {
        tracker.begin(job.name(), clock.instant());
        log.debug("Running job '{}'", job.name());

        try {
            JsonNode payload = runner.run(job, Map.of(), token);
            log.debug("Payload for API '{}' (background run): {}", job.name(), payload);
            tracker.succeed(job.name(), clock.instant());
            log.info("Job '{}' completed successfully", job.name());
        } catch (JobRunException e) {
            tracker.fail(job.name(), e.getMessage());
            log.error("Job '{}' failed: {}", job.name(), e.getMessage(), e);
        } catch (RuntimeException e) {
            tracker.fail(job.name(), e.toString());
            log.error("Job '{}' failed unexpectedly", job.name(), e);
        }
    }
}
