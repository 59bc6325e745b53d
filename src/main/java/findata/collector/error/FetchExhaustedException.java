package findata.collector.error;

/**
 * Every fetch attempt for a job failed. The cause is the last attempt's failure.
 */
public class FetchExhaustedException extends JobRunException {

    private final int attempts;

    public FetchExhaustedException(String jobName, int attempts, Throwable lastCause) {
        super(jobName, describe(lastCause), lastCause);
        this.attempts = attempts;
    }

    /** Number of attempts actually issued. */
    public int attempts() {
        return attempts;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "fetch failed";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.toString() : message;
    }
}
