package findata.collector.api.v1;

import findata.collector.api.Controller;
import findata.collector.api.v1.dto.HealthResponse;
import findata.collector.scheduler.JobScheduler;
import findata.collector.service.JobCatalog;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final JobCatalog catalog;
    private final JobScheduler scheduler;

    public HealthController(JobCatalog catalog, JobScheduler scheduler) {
        this.catalog = catalog;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HealthResponse response = HealthResponse.ok(
                    formatUptime(), VERSION, catalog.size(), scheduler.runningCount());
            return ControllerResponse.json(HttpResponseStatus.OK, response);
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.internalError("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
