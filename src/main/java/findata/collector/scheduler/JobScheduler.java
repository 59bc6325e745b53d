package findata.collector.scheduler;

import findata.collector.fetch.CancellationToken;
import findata.collector.fetch.Sleeper;
import findata.collector.model.JobDescriptor;
import findata.collector.model.LoopState;
import findata.collector.service.JobCatalog;
import findata.collector.service.JobRunner;
import findata.collector.service.JobStatusTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns one independent loop per enabled job.
 *
 * Each loop runs on its own worker thread and is controlled through a
 * {@link CancellationToken}. {@link #start()} is idempotent per job;
 * {@link #stop()} signals every loop and blocks until all of them have
 * terminated.
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobCatalog catalog;
    private final JobRunner runner;
    private final JobStatusTracker tracker;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService executor;

    private final Map<String, RunningJob> running = new LinkedHashMap<>();
    private final Map<String, LoopState> states = new ConcurrentHashMap<>();

    public JobScheduler(JobCatalog catalog, JobRunner runner, JobStatusTracker tracker,
            Sleeper sleeper, Clock clock) {
        this.catalog = catalog;
        this.runner = runner;
        this.tracker = tracker;
        this.sleeper = sleeper;
        this.clock = clock;

        AtomicInteger counter = new AtomicInteger(1);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "findata-job-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Launch a loop for every enabled job that is not already running.
     * Disabled jobs get neither a status entry nor a loop.
     */
    public synchronized void start() {
        for (JobDescriptor job : catalog.all()) {
            if (!job.enabled()) {
                log.info("API '{}' is disabled in config; skipping", job.name());
                continue;
            }
            if (running.containsKey(job.name())) {
                continue;
            }

            tracker.register(job.name());
            CancellationToken token = new CancellationToken();
            JobLoop loop = new JobLoop(job, runner, tracker, sleeper, clock, token);
            Future<?> future = executor.submit(loop);

            running.put(job.name(), new RunningJob(job, token, future));
            states.put(job.name(), LoopState.RUNNING);
            log.info("Started job for API '{}' with interval {} seconds", job.name(), job.intervalSeconds());
        }
    }

    /**
     * Cancel every loop and wait for each to terminate.
     * A loop busy in a request finishes that request and records its outcome first.
     */
    public synchronized void stop() {
        if (running.isEmpty()) {
            return;
        }

        List<RunningJob> stopping = new ArrayList<>(running.values());
        for (RunningJob job : stopping) {
            states.put(job.name(), LoopState.STOPPING);
            job.token().cancel();
        }
        log.info("Stopping {} job loops...", stopping.size());

        boolean interrupted = false;
        for (RunningJob job : stopping) {
            try {
                job.future().get();
            } catch (InterruptedException e) {
                interrupted = true;
                log.warn("Interrupted while waiting for job '{}' to stop", job.name());
                break;
            } catch (ExecutionException e) {
                log.error("Job loop '{}' terminated abnormally", job.name(), e.getCause());
            }
            running.remove(job.name());
            states.put(job.name(), LoopState.STOPPED);
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        } else {
            log.info("All job loops stopped");
        }
    }

    /** Stop every loop and release the worker threads. */
    @Override
    public void close() {
        stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Job scheduler forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public LoopState state(String jobName) {
        return states.getOrDefault(jobName, LoopState.NOT_STARTED);
    }

    public synchronized boolean isRunning(String jobName) {
        return running.containsKey(jobName);
    }

    public int runningCount() {
        return (int) states.values().stream().filter(s -> s == LoopState.RUNNING).count();
    }

    private record RunningJob(JobDescriptor job, CancellationToken token, Future<?> future) {
        String name() {
            return job.name();
        }
    }
}
