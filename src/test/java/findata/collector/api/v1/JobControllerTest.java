package findata.collector.api.v1;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for how run-once requests turn into extra query parameters.
 */
class JobControllerTest {

    private FullHttpRequest request;

    @AfterEach
    void release() {
        if (request != null) {
            request.release();
        }
    }

    private FullHttpRequest post(String uri, String body) {
        request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, uri,
                Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        return request;
    }

    @Test
    void queryStringBecomesParams() {
        Map<String, String> params = JobController.extraParams(
                post("/api/v1/jobs/x/run-once?date=2024-01-01&page=1&page=2", ""));

        assertEquals(Map.of("date", "2024-01-01", "page", "2"), params);
    }

    @Test
    void jsonBodyOverridesQueryString() {
        Map<String, String> params = JobController.extraParams(
                post("/api/v1/jobs/x/run-once?page=1", "{\"page\": 3, \"lang\": \"fa\"}"));

        assertEquals(Map.of("page", "3", "lang", "fa"), params);
    }

    @Test
    void nonObjectBodyIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> JobController.extraParams(post("/api/v1/jobs/x/run-once", "[1,2]")));
    }

    @Test
    void malformedBodyIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> JobController.extraParams(post("/api/v1/jobs/x/run-once", "{oops")));
    }

    @Test
    void matchesOnlyJobRoutes() {
        JobController controller = new JobController(null, null, null);

        assertTrue(controller.matches(HttpMethod.GET, "/api/v1/jobs"));
        assertTrue(controller.matches(HttpMethod.GET, "/api/v1/jobs/fund_compare"));
        assertTrue(controller.matches(HttpMethod.POST, "/api/v1/jobs/fund_compare/run-once"));
        assertTrue(controller.matches(HttpMethod.POST, "/api/v1/jobs/run-all"));
        assertFalse(controller.matches(HttpMethod.DELETE, "/api/v1/jobs/fund_compare"));
        assertFalse(controller.matches(HttpMethod.GET, "/api/v1/jobs/a/b/c"));
    }
}
