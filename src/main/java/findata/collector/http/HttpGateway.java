package findata.collector.http;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Issues HTTP requests on behalf of fetches and forwards.
 * Implementations must be safe for concurrent use by every job loop and trigger.
 */
public interface HttpGateway {

    /**
     * Send a request and return the raw response. Status codes are not
     * interpreted here; callers decide what counts as success.
     *
     * @throws IOException          on transport failure or timeout
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Response send(Request request) throws IOException, InterruptedException;

    /**
     * Outbound request. {@code jsonBody} is null for requests without a body.
     */
    record Request(String method, URI uri, Duration timeout, String jsonBody) {

        public static Request of(String method, URI uri, Duration timeout) {
            return new Request(method, uri, timeout, null);
        }

        public static Request postJson(URI uri, Duration timeout, String jsonBody) {
            return new Request("POST", uri, timeout, jsonBody);
        }

        public boolean hasBody() {
            return jsonBody != null;
        }
    }

    /**
     * Raw response: status code and body text.
     */
    record Response(int statusCode, String body) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
