package findata.collector.error;

/**
 * Delivering a payload to a job's target URL failed. Never retried.
 */
public class ForwardFailedException extends JobRunException {

    public ForwardFailedException(String jobName, String detail, Throwable cause) {
        super(jobName, "Error sending to target: " + detail, cause);
    }

    public ForwardFailedException(String jobName, String detail) {
        this(jobName, detail, null);
    }
}
