package findata.collector.model;

import java.time.Instant;

/**
 * Point-in-time copy of a job's run status.
 * lastRun/lastSuccess/lastError are null until the corresponding event happens.
 */
public record JobStatus(
        Instant lastRun,
        Instant lastSuccess,
        String lastError,
        long runCount) {
}
