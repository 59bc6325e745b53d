package findata.collector.error;

/**
 * The transform registered for a job threw while converting fetched data.
 */
public class TransformFailedException extends JobRunException {

    public TransformFailedException(String jobName, Throwable cause) {
        super(jobName, "Transform failed for job '" + jobName + "': " + cause.getMessage(), cause);
    }
}
