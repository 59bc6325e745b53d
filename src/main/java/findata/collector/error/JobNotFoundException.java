package findata.collector.error;

/**
 * A trigger referenced a job that is unknown or disabled.
 */
public class JobNotFoundException extends RuntimeException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job '" + jobName + "' not found");
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
