package findata.collector.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one polling target.
 * Built once from the job file and never mutated afterwards.
 */
public final class JobDescriptor {
    private final String name;
    private final String url;
    private final String method;
    private final Map<String, String> queryParams;
    private final String targetUrl;
    private final int intervalSeconds;
    private final int maxAttempts;
    private final int backoffSeconds;
    private final int timeoutSeconds;
    private final boolean enabled;

    private JobDescriptor(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.url = Objects.requireNonNull(builder.url, "url is required");
        this.method = Objects.requireNonNull(builder.method, "method is required");
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParams));
        this.targetUrl = builder.targetUrl;
        this.intervalSeconds = builder.intervalSeconds;
        this.maxAttempts = builder.maxAttempts;
        this.backoffSeconds = builder.backoffSeconds;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.enabled = builder.enabled;

        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (url.isBlank()) {
            throw new IllegalArgumentException("job '" + name + "' must have a url");
        }
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("job '" + name + "' interval must be > 0, got " + intervalSeconds);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("job '" + name + "' max attempts must be >= 1, got " + maxAttempts);
        }
        if (backoffSeconds < 0) {
            throw new IllegalArgumentException("job '" + name + "' backoff must be >= 0, got " + backoffSeconds);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("job '" + name + "' timeout must be > 0, got " + timeoutSeconds);
        }
    }

    public String name() {
        return name;
    }

    public String url() {
        return url;
    }

    public String method() {
        return method;
    }

    /** Static query parameters, in configuration order. Never null. */
    public Map<String, String> queryParams() {
        return queryParams;
    }

    public Optional<String> targetUrl() {
        return Optional.ofNullable(targetUrl);
    }

    public boolean forwards() {
        return targetUrl != null;
    }

    public int intervalSeconds() {
        return intervalSeconds;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public int backoffSeconds() {
        return backoffSeconds;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean enabled() {
        return enabled;
    }

    public Duration interval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public Duration backoff() {
        return Duration.ofSeconds(backoffSeconds);
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .url(url)
                .method(method)
                .queryParams(queryParams)
                .targetUrl(targetUrl)
                .intervalSeconds(intervalSeconds)
                .maxAttempts(maxAttempts)
                .backoffSeconds(backoffSeconds)
                .timeoutSeconds(timeoutSeconds)
                .enabled(enabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String url;
        private String method = "GET";
        private Map<String, String> queryParams = Map.of();
        private String targetUrl;
        private int intervalSeconds = 60;
        private int maxAttempts = 3;
        private int backoffSeconds = 5;
        private int timeoutSeconds = 10;
        private boolean enabled = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder method(String method) {
            this.method = method == null ? "GET" : method.toUpperCase();
            return this;
        }

        public Builder queryParams(Map<String, String> queryParams) {
            this.queryParams = queryParams == null ? Map.of() : queryParams;
            return this;
        }

        public Builder targetUrl(String targetUrl) {
            this.targetUrl = targetUrl == null || targetUrl.isBlank() ? null : targetUrl;
            return this;
        }

        public Builder intervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffSeconds(int backoffSeconds) {
            this.backoffSeconds = backoffSeconds;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public JobDescriptor build() {
            return new JobDescriptor(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobDescriptor other))
            return false;
        return Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "JobDescriptor{name='" + name + "', method=" + method + ", url='" + url
                + "', interval=" + intervalSeconds + "s, enabled=" + enabled + "}";
    }
}
