package findata.collector.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the collector service.
 * All settings have sensible defaults.
 */
public final class CollectorConfig {

    // Server settings
    private int serverPort = 8000;
    private String serverHost = "0.0.0.0";

    // Jobs file
    private Path jobsFile = Path.of("config", "config.yaml");

    // Outbound HTTP
    private Duration connectTimeout = Duration.ofSeconds(10);

    private CollectorConfig() {
    }

    public static CollectorConfig defaults() {
        return new CollectorConfig();
    }

    public static CollectorConfig fromEnv() {
        CollectorConfig config = new CollectorConfig();

        String host = System.getenv("FINDATA_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String port = System.getenv("FINDATA_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String jobsFile = System.getenv("FINDATA_CONFIG");
        if (jobsFile != null && !jobsFile.isBlank()) {
            config.jobsFile = Path.of(jobsFile);
        }

        String connectTimeout = System.getenv("FINDATA_CONNECT_TIMEOUT_SECONDS");
        if (connectTimeout != null && !connectTimeout.isBlank()) {
            config.connectTimeout = Duration.ofSeconds(Long.parseLong(connectTimeout.trim()));
        }

        return config;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Path jobsFile() {
        return jobsFile;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    // Fluent setters for testing/customization
    public CollectorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CollectorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CollectorConfig withJobsFile(Path jobsFile) {
        this.jobsFile = jobsFile;
        return this;
    }

    public CollectorConfig withConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    @Override
    public String toString() {
        return "CollectorConfig{" +
                "serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", jobsFile=" + jobsFile +
                ", connectTimeout=" + connectTimeout +
                '}';
    }
}
