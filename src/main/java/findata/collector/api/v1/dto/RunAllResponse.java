package findata.collector.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import findata.collector.model.JobOutcome;
import findata.collector.model.RunAllReport;

import java.util.List;

/**
 * Response DTO for a run-all pass.
 * POST /api/v1/jobs/run-all
 */
public record RunAllResponse(
        @JsonProperty("total") int total,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("results") List<Result> results) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(
            @JsonProperty("name") String name,
            @JsonProperty("ok") boolean ok,
            @JsonProperty("error") String error) {

        static Result from(JobOutcome outcome) {
            return new Result(outcome.name(), outcome.ok(), outcome.error());
        }
    }

    public static RunAllResponse from(RunAllReport report) {
        return new RunAllResponse(
                report.total(),
                report.succeeded(),
                report.failed(),
                report.outcomes().stream().map(Result::from).toList());
    }
}
