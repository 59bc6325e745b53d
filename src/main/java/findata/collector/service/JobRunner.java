package findata.collector.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import findata.collector.error.FetchExhaustedException;
import findata.collector.error.ForwardFailedException;
import findata.collector.error.JobRunException;
import findata.collector.error.TransformFailedException;
import findata.collector.fetch.CancellationToken;
import findata.collector.fetch.RetryExecutor;
import findata.collector.http.HttpGateway;
import findata.collector.model.JobDescriptor;
import findata.collector.transform.PayloadTransformer;
import findata.collector.transform.TransformRegistry;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * One run of a job: fetch (retried), transform (if registered), forward (if configured).
 * Shared by the scheduler loops and the on-demand triggers. Holds no per-run state.
 */
public class JobRunner {

    private final RetryExecutor retryExecutor;
    private final TransformRegistry transforms;
    private final HttpGateway gateway;
    private final ObjectMapper mapper;

    public JobRunner(RetryExecutor retryExecutor, TransformRegistry transforms,
            HttpGateway gateway, ObjectMapper mapper) {
        this.retryExecutor = retryExecutor;
        this.transforms = transforms;
        this.gateway = gateway;
        this.mapper = mapper;
    }

    /**
     * Run the full pipeline.
     *
     * @return the payload after the transform step (what was, or would have been, forwarded)
     */
    public JsonNode run(JobDescriptor job, Map<String, String> extraParams, CancellationToken token)
            throws JobRunException {
        JsonNode data = fetch(job, extraParams, token);
        JsonNode payload = transform(job, data);
        if (job.forwards()) {
            forward(job, payload);
        }
        return payload;
    }

    public JsonNode fetch(JobDescriptor job, Map<String, String> extraParams, CancellationToken token)
            throws FetchExhaustedException {
        return retryExecutor.fetch(job, extraParams, token);
    }

    /** Apply the job's transform; data passes through unchanged when none is registered. */
    public JsonNode transform(JobDescriptor job, JsonNode data) throws TransformFailedException {
        Optional<PayloadTransformer> transformer = transforms.find(job.name());
        if (transformer.isEmpty()) {
            return data;
        }
        try {
            return transformer.get().transform(data);
        } catch (Exception e) {
            throw new TransformFailedException(job.name(), e);
        }
    }

    /**
     * POST the payload to the job's target. Single attempt; non-2xx or transport
     * failure raises {@link ForwardFailedException}.
     */
    public void forward(JobDescriptor job, JsonNode payload) throws ForwardFailedException {
        String target = job.targetUrl()
                .orElseThrow(() -> new IllegalStateException("job '" + job.name() + "' has no target url"));

        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ForwardFailedException(job.name(), "payload is not serializable: " + e.getOriginalMessage(), e);
        }

        HttpGateway.Response response;
        try {
            response = gateway.send(HttpGateway.Request.postJson(URI.create(target), job.timeout(), body));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForwardFailedException(job.name(), "interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            String detail = e.getMessage() == null ? e.toString() : e.getMessage();
            throw new ForwardFailedException(job.name(), detail, e);
        }

        if (!response.isSuccess()) {
            throw new ForwardFailedException(job.name(),
                    "HTTP " + response.statusCode() + " from POST " + target);
        }
    }
}
