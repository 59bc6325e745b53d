package findata.collector.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HttpGateway} backed by one shared, connection-pooling {@link HttpClient}.
 */
public class JdkHttpGateway implements HttpGateway, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpGateway.class);

    private final ExecutorService executor;
    private final HttpClient client;

    public JdkHttpGateway(Duration connectTimeout) {
        AtomicInteger counter = new AtomicInteger(1);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "findata-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .executor(executor)
                .build();
    }

    @Override
    public Response send(Request request) throws IOException, InterruptedException {
        HttpRequest.BodyPublisher body = request.hasBody()
                ? HttpRequest.BodyPublishers.ofString(request.jsonBody(), StandardCharsets.UTF_8)
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .timeout(request.timeout())
                .header("Accept", "application/json")
                .method(request.method(), body);
        if (request.hasBody()) {
            builder.header("Content-Type", "application/json");
        }

        HttpResponse<String> response = client.send(builder.build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
        return new Response(response.statusCode(), response.body());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("HTTP client executor forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
