package findata.collector.http;

import java.io.IOException;
import java.net.URI;

/**
 * A response arrived but its status code was outside 2xx.
 */
public class UnexpectedStatusException extends IOException {

    private final int statusCode;

    public UnexpectedStatusException(String method, URI uri, int statusCode) {
        super("HTTP " + statusCode + " from " + method + " " + uri);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
