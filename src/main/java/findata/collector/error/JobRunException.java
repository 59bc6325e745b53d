package findata.collector.error;

/**
 * Base class for failures of a single run (fetch, transform or forward).
 * Carries the name of the job that failed.
 */
public abstract class JobRunException extends Exception {

    private final String jobName;

    protected JobRunException(String jobName, String message, Throwable cause) {
        super(message, cause);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
