package findata.collector.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("configuredJobs") Integer configuredJobs,
        @JsonProperty("runningJobs") Integer runningJobs) {

    public static HealthResponse ok(String uptime, String version, int configuredJobs, int runningJobs) {
        return new HealthResponse("ok", uptime, version, configuredJobs, runningJobs);
    }
}
