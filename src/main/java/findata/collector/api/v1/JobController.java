package findata.collector.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import findata.collector.api.Controller;
import findata.collector.api.v1.dto.JobStatusResponse;
import findata.collector.api.v1.dto.RunAllResponse;
import findata.collector.error.FetchExhaustedException;
import findata.collector.error.ForwardFailedException;
import findata.collector.error.JobNotFoundException;
import findata.collector.error.JobRunException;
import findata.collector.error.TransformFailedException;
import findata.collector.model.JobDescriptor;
import findata.collector.model.JobStatus;
import findata.collector.model.RunAllReport;
import findata.collector.service.JobCatalog;
import findata.collector.service.JobStatusTracker;
import findata.collector.service.ManualTriggerService;
import findata.collector.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job status and manual triggers.
 *
 * GET  /api/v1/jobs                 - Status of every started job
 * GET  /api/v1/jobs/{name}          - Status of one job
 * POST /api/v1/jobs/{name}/run-once - Run one job now (extra query params via query string or JSON body)
 * POST /api/v1/jobs/run-all         - Fetch every enabled job once, report per job
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern RUN_ALL_PATTERN = Pattern.compile("^/api/v1/jobs/run-all$");
    private static final Pattern JOB_BY_NAME_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern RUN_ONCE_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/run-once$");

    private final JobCatalog catalog;
    private final JobStatusTracker tracker;
    private final ManualTriggerService triggers;

    public JobController(JobCatalog catalog, JobStatusTracker tracker, ManualTriggerService triggers) {
        this.catalog = catalog;
        this.tracker = tracker;
        this.triggers = triggers;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return RUN_ALL_PATTERN.matcher(path).matches() || RUN_ONCE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_BY_NAME_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                if (RUN_ALL_PATTERN.matcher(path).matches()) {
                    return handleRunAll();
                }
                Matcher runOnce = RUN_ONCE_PATTERN.matcher(path);
                if (runOnce.matches()) {
                    return handleRunOnce(decode(runOnce.group(1)), req);
                }
            }

            if (req.method().equals(HttpMethod.GET)) {
                if (JOBS_PATTERN.matcher(path).matches()) {
                    return handleListJobs();
                }
                Matcher byName = JOB_BY_NAME_PATTERN.matcher(path);
                if (byName.matches()) {
                    return handleGetJob(decode(byName.group(1)));
                }
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.internalError("internal error");
        }
    }

    /**
     * GET /api/v1/jobs - jobs without a status entry (never started) are left out
     */
    private ControllerResponse handleListJobs() throws JsonProcessingException {
        List<JobStatusResponse> statuses = new ArrayList<>();
        for (JobDescriptor job : catalog.all()) {
            tracker.snapshot(job.name())
                    .ifPresent(status -> statuses.add(JobStatusResponse.from(job, status)));
        }
        return ControllerResponse.json(HttpResponseStatus.OK, statuses);
    }

    /**
     * GET /api/v1/jobs/{name}
     */
    private ControllerResponse handleGetJob(String name) throws JsonProcessingException {
        Optional<JobDescriptor> job = catalog.find(name);
        Optional<JobStatus> status = tracker.snapshot(name);
        if (job.isEmpty() || status.isEmpty()) {
            return ControllerResponse.notFound("Job '" + name + "' not found");
        }
        return ControllerResponse.json(HttpResponseStatus.OK, JobStatusResponse.from(job.get(), status.get()));
    }

    /**
     * POST /api/v1/jobs/{name}/run-once
     */
    private ControllerResponse handleRunOnce(String name, FullHttpRequest req) throws JsonProcessingException {
        Map<String, String> extraParams = extraParams(req);
        try {
            triggers.runOnce(name, extraParams);
            return ControllerResponse.json(HttpResponseStatus.OK, Map.of("status", "ok"));
        } catch (JobNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (FetchExhaustedException | ForwardFailedException e) {
            return ControllerResponse.badGateway(e.getMessage());
        } catch (TransformFailedException e) {
            return ControllerResponse.internalError(e.getMessage());
        } catch (JobRunException e) {
            return ControllerResponse.internalError(e.getMessage());
        }
    }

    /**
     * POST /api/v1/jobs/run-all
     */
    private ControllerResponse handleRunAll() throws JsonProcessingException {
        RunAllReport report = triggers.runAllOnce();
        return ControllerResponse.json(HttpResponseStatus.OK, RunAllResponse.from(report));
    }

    /**
     * Query string parameters, overlaid by a flat JSON object body when one is sent.
     */
    static Map<String, String> extraParams(FullHttpRequest req) {
        Map<String, String> params = new LinkedHashMap<>();

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        for (Map.Entry<String, List<String>> entry : decoder.parameters().entrySet()) {
            List<String> values = entry.getValue();
            params.put(entry.getKey(), values.isEmpty() ? "" : values.get(values.size() - 1));
        }

        String body = req.content().toString(StandardCharsets.UTF_8);
        if (!body.isBlank()) {
            JsonNode node;
            try {
                node = Json.mapper().readTree(body);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("request body is not valid JSON: " + e.getOriginalMessage());
            }
            if (!node.isObject()) {
                throw new IllegalArgumentException("request body must be a JSON object of query parameters");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                params.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        }
        return params;
    }

    private static String decode(String segment) {
        return QueryStringDecoder.decodeComponent(segment);
    }
}
