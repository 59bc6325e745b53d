package findata.collector.model;

/**
 * Lifecycle of a job's scheduled loop.
 */
public enum LoopState {
    NOT_STARTED,
    RUNNING,
    STOPPING,
    STOPPED
}
