package findata.collector.model;

import java.util.List;

/**
 * Per-job outcomes of a run-all pass, in configuration order.
 */
public record RunAllReport(List<JobOutcome> outcomes) {

    public RunAllReport {
        outcomes = List.copyOf(outcomes);
    }

    public int total() {
        return outcomes.size();
    }

    public int succeeded() {
        return (int) outcomes.stream().filter(JobOutcome::ok).count();
    }

    public int failed() {
        return total() - succeeded();
    }
}
