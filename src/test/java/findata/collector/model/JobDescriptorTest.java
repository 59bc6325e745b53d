package findata.collector.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobDescriptorTest {

    private static JobDescriptor.Builder base() {
        return JobDescriptor.builder().name("rates").url("http://h/rates");
    }

    @Test
    void defaults() {
        JobDescriptor job = base().build();

        assertEquals("GET", job.method());
        assertEquals(Duration.ofSeconds(60), job.interval());
        assertEquals(3, job.maxAttempts());
        assertEquals(Duration.ofSeconds(5), job.backoff());
        assertEquals(Duration.ofSeconds(10), job.timeout());
        assertTrue(job.enabled());
        assertTrue(job.queryParams().isEmpty());
        assertTrue(job.targetUrl().isEmpty());
        assertFalse(job.forwards());
    }

    @Test
    void methodIsUpperCased() {
        assertEquals("POST", base().method("post").build().method());
    }

    @Test
    void blankTargetMeansNoForwarding() {
        JobDescriptor job = base().targetUrl("  ").build();

        assertFalse(job.forwards());
        assertTrue(job.targetUrl().isEmpty());
    }

    @Test
    void queryParamsAreCopied() {
        Map<String, String> params = new HashMap<>();
        params.put("a", "1");
        JobDescriptor job = base().queryParams(params).build();
        params.put("b", "2");

        assertEquals(Map.of("a", "1"), job.queryParams());
        assertThrows(UnsupportedOperationException.class, () -> job.queryParams().put("c", "3"));
    }

    @Test
    void rejectsInvalidTiming() {
        assertThrows(IllegalArgumentException.class, () -> base().intervalSeconds(0).build());
        assertThrows(IllegalArgumentException.class, () -> base().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> base().backoffSeconds(-1).build());
        assertThrows(IllegalArgumentException.class, () -> base().timeoutSeconds(0).build());
    }

    @Test
    void zeroBackoffIsAllowed() {
        assertEquals(Duration.ZERO, base().backoffSeconds(0).build().backoff());
    }

    @Test
    void rejectsMissingIdentity() {
        assertThrows(NullPointerException.class, () -> JobDescriptor.builder().url("http://h").build());
        assertThrows(IllegalArgumentException.class, () -> base().name(" ").build());
        assertThrows(IllegalArgumentException.class, () -> base().url("").build());
    }

    @Test
    void toBuilderPreservesFields() {
        JobDescriptor job = base().targetUrl("http://sink").maxAttempts(7).enabled(false).build();
        JobDescriptor copy = job.toBuilder().intervalSeconds(5).build();

        assertEquals("http://sink", copy.targetUrl().orElseThrow());
        assertEquals(7, copy.maxAttempts());
        assertFalse(copy.enabled());
        assertEquals(5, copy.intervalSeconds());
        assertEquals(job, copy);
    }
}
