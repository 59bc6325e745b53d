package findata.collector.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import findata.collector.model.JobDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the job list from a YAML file.
 *
 * <pre>
 * apis:
 *   - name: fund_compare
 *     url: https://example.org/api/fund/fundcompare
 *     method: GET                 # default GET
 *     interval_seconds: 60        # default 60
 *     max_retries: 3              # attempts, default 3
 *     retry_backoff_seconds: 5    # default 5
 *     timeout_seconds: 10         # default 10
 *     target_url: http://sink/in  # optional
 *     enabled: true               # default true
 *     query_params:               # optional
 *       lang: en
 * </pre>
 *
 * Any structural problem fails the whole load; the service does not start
 * with a partial job list.
 */
public final class JobsConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(JobsConfigLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private JobsConfigLoader() {
    }

    public static List<JobDescriptor> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Config file not found");
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<JobDescriptor> jobs = parse(YAML.readTree(in));
            log.info("Loaded {} job(s) from {}", jobs.size(), path);
            return jobs;
        }
    }

    public static List<JobDescriptor> parse(String yaml) throws IOException {
        return parse(YAML.readTree(yaml));
    }

    static List<JobDescriptor> parse(JsonNode root) {
        JsonNode apis = root == null ? null : root.get("apis");
        if (apis == null || !apis.isArray()) {
            throw new IllegalArgumentException("Config file must contain a top-level 'apis' list.");
        }

        List<JobDescriptor> jobs = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (JsonNode entry : apis) {
            if (!entry.isObject()) {
                throw new IllegalArgumentException("Each item in 'apis' must be an object/dict.");
            }

            String name = text(entry, "name");
            if (name == null) {
                throw new IllegalArgumentException("Each API config must have a 'name' field.");
            }
            String url = text(entry, "url");
            if (url == null) {
                throw new IllegalArgumentException("API '" + name + "' must have a 'url' field.");
            }
            checkUrl(name, "url", url);
            String targetUrl = text(entry, "target_url");
            if (targetUrl != null) {
                checkUrl(name, "target_url", targetUrl);
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException("Duplicate API name '" + name + "'.");
            }

            JobDescriptor job = JobDescriptor.builder()
                    .name(name)
                    .url(url)
                    .method(textOr(entry, "method", "GET"))
                    .intervalSeconds(intOr(entry, name, "interval_seconds", 60))
                    .maxAttempts(intOr(entry, name, "max_retries", 3))
                    .backoffSeconds(intOr(entry, name, "retry_backoff_seconds", 5))
                    .timeoutSeconds(intOr(entry, name, "timeout_seconds", 10))
                    .targetUrl(targetUrl)
                    .enabled(boolOr(entry, "enabled", true))
                    .queryParams(queryParams(entry, name))
                    .build();
            jobs.add(job);
        }

        if (jobs.isEmpty()) {
            throw new IllegalArgumentException("No APIs configured in config file.");
        }
        return jobs;
    }

    private static Map<String, String> queryParams(JsonNode entry, String name) {
        JsonNode raw = entry.get("query_params");
        if (raw == null || raw.isNull()) {
            return Map.of();
        }
        if (!raw.isObject()) {
            throw new IllegalArgumentException(
                    "API '" + name + "' has invalid 'query_params' (must be an object/dict).");
        }
        Map<String, String> params = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            params.put(field.getKey(), value.isNull() ? "" : value.asText());
        }
        return params;
    }

    /** Must parse as an absolute http(s) URI. */
    private static void checkUrl(String name, String field, String value) {
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "API '" + name + "' has invalid '" + field + "': " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
            throw new IllegalArgumentException(
                    "API '" + name + "' has invalid '" + field + "': expected an absolute http(s) URL, got " + value);
        }
    }

    /** Non-empty text value, or null when absent, null or blank. */
    private static String text(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static String textOr(JsonNode entry, String field, String fallback) {
        String value = text(entry, field);
        return value == null ? fallback : value;
    }

    private static int intOr(JsonNode entry, String name, String field, int fallback) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToInt()) {
                throw new IllegalArgumentException(
                        "API '" + name + "' has invalid '" + field + "' (out of range): " + node.asText());
            }
            return node.intValue();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "API '" + name + "' has invalid '" + field + "' (must be an integer): " + node.asText());
        }
    }

    private static boolean boolOr(JsonNode entry, String field, boolean fallback) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return node.asBoolean(fallback);
    }
}
