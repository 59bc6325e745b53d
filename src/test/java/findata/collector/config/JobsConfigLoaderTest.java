package findata.collector.config;

import findata.collector.model.JobDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobsConfigLoaderTest {

    @Test
    void parsesFullEntry() throws Exception {
        List<JobDescriptor> jobs = JobsConfigLoader.parse("""
                apis:
                  - name: fund_compare
                    url: https://example.org/api/fund/fundcompare
                    method: post
                    interval_seconds: 120
                    max_retries: 4
                    retry_backoff_seconds: 2
                    timeout_seconds: 15
                    target_url: http://sink/in
                    enabled: false
                    query_params:
                      lang: en
                      page: 1
                      empty: null
                """);

        JobDescriptor job = jobs.get(0);
        assertEquals("fund_compare", job.name());
        assertEquals("POST", job.method());
        assertEquals(120, job.intervalSeconds());
        assertEquals(4, job.maxAttempts());
        assertEquals(2, job.backoffSeconds());
        assertEquals(15, job.timeoutSeconds());
        assertEquals("http://sink/in", job.targetUrl().orElseThrow());
        assertFalse(job.enabled());
        assertEquals(Map.of("lang", "en", "page", "1", "empty", ""), job.queryParams());
    }

    @Test
    void appliesDefaultsAndKeepsOrder() throws Exception {
        List<JobDescriptor> jobs = JobsConfigLoader.parse("""
                apis:
                  - name: b
                    url: http://h/b
                  - name: a
                    url: http://h/a
                    interval_seconds: "30"
                """);

        assertEquals(List.of("b", "a"), jobs.stream().map(JobDescriptor::name).toList());
        JobDescriptor b = jobs.get(0);
        assertEquals("GET", b.method());
        assertEquals(60, b.intervalSeconds());
        assertEquals(3, b.maxAttempts());
        assertEquals(5, b.backoffSeconds());
        assertEquals(10, b.timeoutSeconds());
        assertTrue(b.enabled());
        assertEquals(30, jobs.get(1).intervalSeconds());
    }

    @Test
    void rejectsMissingApisList() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JobsConfigLoader.parse("jobs: []"));
        assertEquals("Config file must contain a top-level 'apis' list.", e.getMessage());
    }

    @Test
    void rejectsEmptyList() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JobsConfigLoader.parse("apis: []"));
        assertEquals("No APIs configured in config file.", e.getMessage());
    }

    @Test
    void rejectsStructuralProblems() {
        assertEquals("Each item in 'apis' must be an object/dict.", assertThrows(IllegalArgumentException.class,
                () -> JobsConfigLoader.parse("apis:\n  - just-a-string\n")).getMessage());
        assertEquals("Each API config must have a 'name' field.", assertThrows(IllegalArgumentException.class,
                () -> JobsConfigLoader.parse("apis:\n  - url: http://h\n")).getMessage());
        assertEquals("API 'x' must have a 'url' field.", assertThrows(IllegalArgumentException.class,
                () -> JobsConfigLoader.parse("apis:\n  - name: x\n")).getMessage());
        assertEquals("API 'x' has invalid 'query_params' (must be an object/dict).",
                assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                        "apis:\n  - name: x\n    url: http://h\n    query_params: [a, b]\n")).getMessage());
    }

    @Test
    void rejectsDuplicateNames() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse("""
                apis:
                  - name: x
                    url: http://h/1
                  - name: x
                    url: http://h/2
                """));
        assertEquals("Duplicate API name 'x'.", e.getMessage());
    }

    @Test
    void rejectsInvalidNumbers() {
        assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                "apis:\n  - name: x\n    url: http://h\n    interval_seconds: soon\n"));
        assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                "apis:\n  - name: x\n    url: http://h\n    interval_seconds: 0\n"));
    }

    @Test
    void rejectsUrlThatCannotBeParsed() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                "apis:\n  - name: bad\n    url: \"http://up.test/a b\"\n"));

        assertTrue(e.getMessage().startsWith("API 'bad' has invalid 'url'"), e.getMessage());
    }

    @Test
    void rejectsUrlWithoutHttpScheme() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                "apis:\n  - name: rel\n    url: /only/a/path\n"));

        assertTrue(e.getMessage().startsWith("API 'rel' has invalid 'url'"), e.getMessage());
    }

    @Test
    void rejectsMalformedTargetUrl() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                "apis:\n  - name: x\n    url: http://h/a\n    target_url: \"http://sink/in put\"\n"));

        assertTrue(e.getMessage().startsWith("API 'x' has invalid 'target_url'"), e.getMessage());
    }

    @Test
    void rejectsIntegersThatDoNotFit() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                "apis:\n  - name: x\n    url: http://h\n    interval_seconds: 3000000000\n"));

        assertTrue(e.getMessage().contains("'interval_seconds'"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> JobsConfigLoader.parse(
                "apis:\n  - name: x\n    url: http://h\n    timeout_seconds: \"3000000000\"\n"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, "apis:\n  - name: x\n    url: http://h\n");

        assertEquals(1, JobsConfigLoader.load(file).size());
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        assertThrows(NoSuchFileException.class, () -> JobsConfigLoader.load(dir.resolve("absent.yaml")));
    }
}
