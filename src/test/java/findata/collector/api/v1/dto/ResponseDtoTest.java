package findata.collector.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import findata.collector.model.JobDescriptor;
import findata.collector.model.JobOutcome;
import findata.collector.model.JobStatus;
import findata.collector.model.RunAllReport;
import findata.collector.util.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Serialization tests for the public API response DTOs.
 */
class ResponseDtoTest {

    private static final ObjectMapper MAPPER = Json.mapper();

    @Test
    void jobStatusResponseSerialization() throws Exception {
        JobDescriptor job = JobDescriptor.builder().name("x").url("http://h/x").intervalSeconds(30).build();
        Instant run = Instant.parse("2024-01-01T00:00:00Z");
        JobStatusResponse dto = JobStatusResponse.from(job, new JobStatus(run, null, "HTTP 500", 4));

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(dto));

        assertEquals("x", json.get("name").asText());
        assertEquals("http://h/x", json.get("url").asText());
        assertEquals(30, json.get("intervalSeconds").asInt());
        assertTrue(json.get("enabled").asBoolean());
        assertEquals("2024-01-01T00:00:00Z", json.get("lastRun").asText());
        assertTrue(json.get("lastSuccess").isNull());
        assertEquals("HTTP 500", json.get("lastError").asText());
        assertEquals(4, json.get("runCount").asLong());
    }

    @Test
    void runAllResponseOmitsNullErrors() throws Exception {
        RunAllReport report = new RunAllReport(List.of(
                JobOutcome.success("a"),
                JobOutcome.failure("b", "HTTP 503")));

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(RunAllResponse.from(report)));

        assertEquals(2, json.get("total").asInt());
        assertEquals(1, json.get("succeeded").asInt());
        assertEquals(1, json.get("failed").asInt());
        JsonNode first = json.get("results").get(0);
        assertTrue(first.get("ok").asBoolean());
        assertFalse(first.has("error"));
        assertEquals("HTTP 503", json.get("results").get(1).get("error").asText());
    }

    @Test
    void healthResponseSerialization() throws Exception {
        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(HealthResponse.ok("0h 1m", "1.0.0", 3, 2)));

        assertEquals("ok", json.get("status").asText());
        assertEquals(3, json.get("configuredJobs").asInt());
        assertEquals(2, json.get("runningJobs").asInt());
    }
}
