package findata.collector.service;

import com.fasterxml.jackson.databind.JsonNode;
import findata.collector.error.JobNotFoundException;
import findata.collector.error.JobRunException;
import findata.collector.fetch.CancellationToken;
import findata.collector.model.JobDescriptor;
import findata.collector.model.JobOutcome;
import findata.collector.model.RunAllReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * On-demand execution outside the schedule.
 *
 * Uses the same fetch/retry machinery as the scheduled loops. A successful
 * single-job run is recorded in the job's status; a failed one is reported to
 * the caller only and leaves the status as it was.
 */
public class ManualTriggerService {

    private static final Logger log = LoggerFactory.getLogger(ManualTriggerService.class);

    private final JobCatalog catalog;
    private final JobRunner runner;
    private final JobStatusTracker tracker;
    private final Clock clock;

    public ManualTriggerService(JobCatalog catalog, JobRunner runner, JobStatusTracker tracker, Clock clock) {
        this.catalog = catalog;
        this.runner = runner;
        this.tracker = tracker;
        this.clock = clock;
    }

    /**
     * Run one job now.
     *
     * @param extraParams merged over the job's static query parameters, winning on collision
     * @return the payload that was forwarded (or would have been, for jobs without a target)
     * @throws JobNotFoundException if the job is unknown or disabled
     * @throws JobRunException      fetch, transform or forward failure
     */
    public JsonNode runOnce(String jobName, Map<String, String> extraParams) throws JobRunException {
        JobDescriptor job = catalog.findEnabled(jobName)
                .orElseThrow(() -> new JobNotFoundException(jobName));

        log.info("Manual run of job '{}' with extra params {}", jobName, extraParams);
        JsonNode payload = runner.run(job, extraParams, CancellationToken.none());
        log.debug("Payload for job '{}' (manual run): {}", jobName, payload);

        tracker.recordManualSuccess(jobName, clock.instant());
        log.info("Manual run of job '{}' completed successfully", jobName);
        return payload;
    }

    /**
     * Fetch every enabled job once and report per-job outcomes.
     * Neither transforms, forwards nor touches job status. Never throws.
     */
    public RunAllReport runAllOnce() {
        List<JobOutcome> outcomes = new ArrayList<>();

        for (JobDescriptor job : catalog.enabled()) {
            try {
                runner.fetch(job, Map.of(), CancellationToken.none());
                outcomes.add(JobOutcome.success(job.name()));
            } catch (Exception e) {
                log.warn("Run-all: job '{}' failed: {}", job.name(), e.getMessage());
                outcomes.add(JobOutcome.failure(job.name(), messageOf(e)));
            }
        }

        RunAllReport report = new RunAllReport(outcomes);
        log.info("Run-all finished: {} succeeded, {} failed", report.succeeded(), report.failed());
        return report;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() == null ? e.toString() : e.getMessage();
    }
}
