package findata.collector.model;

/**
 * Result of fetching one job during a run-all pass.
 */
public record JobOutcome(String name, boolean ok, String error) {

    public static JobOutcome success(String name) {
        return new JobOutcome(name, true, null);
    }

    public static JobOutcome failure(String name, String error) {
        return new JobOutcome(name, false, error);
    }
}
