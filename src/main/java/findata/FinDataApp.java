package findata;

import findata.collector.config.CollectorConfig;
import findata.collector.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point.
 *
 * Loads the job file (startup aborts on any config error), starts the HTTP
 * API and the job loops, then blocks until the JVM is asked to shut down.
 */
public final class FinDataApp {

    private static final Logger log = LoggerFactory.getLogger(FinDataApp.class);

    private FinDataApp() {
    }

    public static void main(String[] args) throws Exception {
        CollectorConfig config = CollectorConfig.fromEnv();

        Dependencies deps;
        try {
            deps = Dependencies.create(config);
        } catch (Exception e) {
            log.error("Failed to load configuration from {}: {}", config.jobsFile(), e.getMessage());
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            log.info("FinData shutdown completed");
            stopped.countDown();
        }, "findata-shutdown"));

        deps.startServer();
        deps.startScheduler();
        log.info("FinData startup completed");

        stopped.await();
    }
}
