package findata.collector.service;

import findata.collector.model.JobStatus;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live run status of every started job.
 *
 * Entries are created by the scheduler when a job's loop starts and live for
 * the rest of the process. Each entry has its own lock, so a scheduled run and
 * a manual trigger for the same job never leave a torn record behind. A
 * missing entry means the job was never started (disabled or unknown).
 */
public class JobStatusTracker {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Create a zeroed entry unless one already exists.
     *
     * @return true if a new entry was created
     */
    public boolean register(String jobName) {
        return entries.putIfAbsent(jobName, new Entry()) == null;
    }

    public boolean isTracked(String jobName) {
        return entries.containsKey(jobName);
    }

    /** Immutable copy of the job's status, or empty if the job was never started. */
    public Optional<JobStatus> snapshot(String jobName) {
        Entry entry = entries.get(jobName);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    /** Scheduled run started: stamp lastRun and bump runCount. */
    public void begin(String jobName, Instant now) {
        entry(jobName).ifPresent(e -> e.begin(now));
    }

    /** Scheduled run finished without error. */
    public void succeed(String jobName, Instant now) {
        entry(jobName).ifPresent(e -> e.succeed(now));
    }

    /** Scheduled run failed; lastSuccess is left untouched. */
    public void fail(String jobName, String message) {
        entry(jobName).ifPresent(e -> e.fail(message));
    }

    /** Manual run succeeded: all four fields updated as one step. */
    public void recordManualSuccess(String jobName, Instant now) {
        entry(jobName).ifPresent(e -> e.manualSuccess(now));
    }

    private Optional<Entry> entry(String jobName) {
        return Optional.ofNullable(entries.get(jobName));
    }

    private static final class Entry {
        private Instant lastRun;
        private Instant lastSuccess;
        private String lastError;
        private long runCount;

        synchronized void begin(Instant now) {
            lastRun = now;
            runCount++;
        }

        synchronized void succeed(Instant now) {
            lastSuccess = now;
            lastError = null;
        }

        synchronized void fail(String message) {
            lastError = message == null ? "unknown error" : message;
        }

        synchronized void manualSuccess(Instant now) {
            lastRun = now;
            lastSuccess = now;
            lastError = null;
            runCount++;
        }

        synchronized JobStatus snapshot() {
            return new JobStatus(lastRun, lastSuccess, lastError, runCount);
        }
    }
}
