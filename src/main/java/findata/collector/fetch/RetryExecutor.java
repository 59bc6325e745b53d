package findata.collector.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import findata.collector.error.FetchExhaustedException;
import findata.collector.http.HttpGateway;
import findata.collector.http.UnexpectedStatusException;
import findata.collector.model.JobDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Performs one logical fetch for a job with bounded retries and a fixed backoff.
 *
 * Each attempt sends the job's request with the job's timeout. A non-2xx
 * status, a transport failure or a body that is not JSON fails the attempt.
 * Between failed attempts (never after the last one) the executor waits
 * exactly the job's backoff. Stateless and shared by the scheduler and the
 * on-demand triggers.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final HttpGateway gateway;
    private final Sleeper sleeper;
    private final ObjectMapper mapper;

    public RetryExecutor(HttpGateway gateway, Sleeper sleeper, ObjectMapper mapper) {
        this.gateway = gateway;
        this.sleeper = sleeper;
        this.mapper = mapper;
    }

    /**
     * Fetch with the job's static query parameters only.
     */
    public JsonNode fetch(JobDescriptor job, CancellationToken token) throws FetchExhaustedException {
        return fetch(job, Map.of(), token);
    }

    /**
     * Fetch with {@code extraParams} merged over the job's static query parameters.
     *
     * @param token cancellation observed only during backoff waits; when it fires
     *              the remaining attempts are abandoned
     * @return parsed JSON body of the first successful attempt
     * @throws FetchExhaustedException carrying the last attempt's failure, or the URL error with zero attempts
     */
    public JsonNode fetch(JobDescriptor job, Map<String, String> extraParams, CancellationToken token)
            throws FetchExhaustedException {
        HttpGateway.Request request;
        try {
            URI uri = QueryParams.appendTo(job.url(), QueryParams.merge(job.queryParams(), extraParams));
            request = HttpGateway.Request.of(job.method(), uri, job.timeout());
        } catch (RuntimeException e) {
            log.error("Cannot build request for API '{}' from url '{}': {}", job.name(), job.url(), e.getMessage());
            throw new FetchExhaustedException(job.name(), 0, e);
        }

        int maxAttempts = job.maxAttempts();
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attemptOnce(request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchExhaustedException(job.name(), attempt, e);
            } catch (Exception e) {
                lastError = e;
                log.warn("Call to API '{}' failed on attempt {}/{}: {}",
                        job.name(), attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                try {
                    if (!sleeper.sleep(job.backoff(), token)) {
                        log.info("Job '{}' cancelled during backoff after attempt {}/{}",
                                job.name(), attempt, maxAttempts);
                        throw new FetchExhaustedException(job.name(), attempt, lastError);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchExhaustedException(job.name(), attempt, lastError);
                }
            }
        }

        throw new FetchExhaustedException(job.name(), maxAttempts, lastError);
    }

    private JsonNode attemptOnce(HttpGateway.Request request) throws IOException, InterruptedException {
        HttpGateway.Response response = gateway.send(request);
        if (!response.isSuccess()) {
            throw new UnexpectedStatusException(request.method(), request.uri(), response.statusCode());
        }
        JsonNode body;
        try {
            body = mapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed JSON from " + request.uri() + ": " + e.getOriginalMessage(), e);
        }
        if (body == null || body.isMissingNode()) {
            throw new IOException("Empty response body from " + request.uri());
        }
        return body;
    }
}
