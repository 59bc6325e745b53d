package findata.collector.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import findata.collector.model.JobDescriptor;
import findata.collector.model.JobStatus;

import java.time.Instant;

/**
 * One job's configuration summary plus its live status.
 * GET /api/v1/jobs, GET /api/v1/jobs/{name}
 */
public record JobStatusResponse(
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("intervalSeconds") int intervalSeconds,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("lastRun") Instant lastRun,
        @JsonProperty("lastSuccess") Instant lastSuccess,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("runCount") long runCount) {

    public static JobStatusResponse from(JobDescriptor job, JobStatus status) {
        return new JobStatusResponse(
                job.name(),
                job.url(),
                job.intervalSeconds(),
                job.enabled(),
                status.lastRun(),
                status.lastSuccess(),
                status.lastError(),
                status.runCount());
    }
}
