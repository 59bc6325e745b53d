package findata.collector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import findata.collector.api.v1.HealthController;
import findata.collector.api.v1.JobController;
import findata.collector.fetch.RetryExecutor;
import findata.collector.fetch.Sleeper;
import findata.collector.http.HttpGateway;
import findata.collector.http.JdkHttpGateway;
import findata.collector.model.JobDescriptor;
import findata.collector.scheduler.JobScheduler;
import findata.collector.server.CollectorNettyServer;
import findata.collector.server.RouterHandler;
import findata.collector.service.JobCatalog;
import findata.collector.service.JobRunner;
import findata.collector.service.JobStatusTracker;
import findata.collector.service.ManualTriggerService;
import findata.collector.transform.TransformRegistry;
import findata.collector.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CollectorConfig.fromEnv());
 * deps.startServer();
 * deps.startScheduler();
 * // ... serve ...
 * deps.close(); // server, then scheduler, then HTTP client
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CollectorConfig config;
    private final HttpGateway gateway;
    private final JobCatalog catalog;
    private final JobStatusTracker tracker;
    private final JobRunner runner;
    private final JobScheduler scheduler;
    private final ManualTriggerService triggers;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;

    // Server (lazy-initialized)
    private volatile CollectorNettyServer server;

    private Dependencies(CollectorConfig config, List<JobDescriptor> jobs, HttpGateway gateway,
            TransformRegistry transforms, Sleeper sleeper, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        ObjectMapper mapper = Json.mapper();

        // Infrastructure
        this.gateway = gateway;

        // Registries
        this.catalog = new JobCatalog(jobs);
        this.tracker = new JobStatusTracker();

        // Services
        RetryExecutor retryExecutor = new RetryExecutor(gateway, sleeper, mapper);
        this.runner = new JobRunner(retryExecutor, transforms, gateway, mapper);
        this.scheduler = new JobScheduler(catalog, runner, tracker, sleeper, clock);
        this.triggers = new ManualTriggerService(catalog, runner, tracker, clock);

        // Controllers
        this.healthController = new HealthController(catalog, scheduler);
        this.jobController = new JobController(catalog, tracker, triggers);

        log.info("Dependencies initialized: {} job(s), {} transform(s)", catalog.size(), transforms.size());
    }

    /**
     * Create dependencies, loading the job list from {@link CollectorConfig#jobsFile()}.
     */
    public static Dependencies create(CollectorConfig config) throws IOException {
        return create(config, JobsConfigLoader.load(config.jobsFile()));
    }

    /**
     * Create dependencies for an already loaded job list with the production
     * HTTP client, transforms, sleeper and clock.
     */
    public static Dependencies create(CollectorConfig config, List<JobDescriptor> jobs) {
        Clock clock = Clock.systemUTC();
        return create(config, jobs, new JdkHttpGateway(config.connectTimeout()),
                TransformRegistry.builtIn(Json.mapper(), clock), Sleeper.cancellable(), clock);
    }

    public static Dependencies create(CollectorConfig config, List<JobDescriptor> jobs, HttpGateway gateway,
            TransformRegistry transforms, Sleeper sleeper, Clock clock) {
        return new Dependencies(config, jobs, gateway, transforms, sleeper, clock);
    }

    // Getters
    public CollectorConfig config() {
        return config;
    }

    public JobCatalog catalog() {
        return catalog;
    }

    public JobStatusTracker tracker() {
        return tracker;
    }

    public JobRunner runner() {
        return runner;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public ManualTriggerService triggers() {
        return triggers;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        return new RouterHandler()
                .registerController(healthController)
                .registerController(jobController);
    }

    public synchronized CollectorNettyServer server() {
        if (server == null) {
            server = new CollectorNettyServer(config, routerHandler());
        }
        return server;
    }

    public void startServer() throws InterruptedException {
        server().start();
    }

    public void startScheduler() {
        scheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop accepting triggers first
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        // Then wait for every job loop
        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        // Release the shared client last
        if (gateway instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP client: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
