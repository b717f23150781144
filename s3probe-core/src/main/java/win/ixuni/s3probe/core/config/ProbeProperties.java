package win.ixuni.s3probe.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * S3Probe main configuration
 */
@Data
@ConfigurationProperties(prefix = "s3probe")
public class ProbeProperties {

    private GatewayConfig gateway = new GatewayConfig();

    private ConnectionConfig connection = new ConnectionConfig();

    private TestDataConfig testData = new TestDataConfig();

    /**
     * Per-category enable flags. Categories missing from the map are enabled.
     */
    private Map<String, Boolean> checks = new LinkedHashMap<>();

    private TimeoutConfig timeouts = new TimeoutConfig();

    private RunConfig run = new RunConfig();

    public boolean isCategoryEnabled(String category) {
        return checks.getOrDefault(category, Boolean.TRUE);
    }

    /**
     * Gateway selection
     */
    @Data
    public static class GatewayConfig {

        /**
         * "s3" for a remote endpoint, "memory" for an in-process store (self-test, dry run)
         */
        private String type = "s3";
    }

    /**
     * Target endpoint and credentials
     */
    @Data
    public static class ConnectionConfig {

        private String endpointUrl = "http://localhost:9000";

        private String accessKey;

        private String secretKey;

        private String region = "us-east-1";

        /**
         * Verify the endpoint's TLS certificate. Test endpoints often use self-signed ones.
         */
        private boolean verifySsl = false;

        /**
         * Retries of transient failures inside the gateway
         */
        private int maxRetries = 3;

        /**
         * Path-style addressing (http://host/bucket/key); most S3-compatible servers need it
         */
        private boolean pathStyleAccess = true;
    }

    /**
     * Sizes and content of generated test objects
     */
    @Data
    public static class TestDataConfig {

        private int smallFileSize = 1024;

        private int mediumFileSize = 1024 * 1024;

        private int largeFileSize = 10 * 1024 * 1024;

        /**
         * Part size for multipart probes. Must be at least the backend's minimum part size (5 MiB on AWS).
         */
        private int multipartChunkSize = 5 * 1024 * 1024;

        private String testFileContent = "S3 compatibility test data";

        /**
         * Delete every resource created by a category once it finishes
         */
        private boolean cleanupEnabled = true;

        /**
         * Prefix of generated bucket names, {prefix}-{category}-{millis}
         */
        private String bucketPrefix = "s3probe";
    }

    @Data
    public static class TimeoutConfig {

        private Duration operation = Duration.ofSeconds(30);

        private Duration upload = Duration.ofSeconds(300);

        private Duration download = Duration.ofSeconds(300);

        /**
         * Overall run deadline. Probes not started before it are recorded as failed.
         */
        private Duration runDeadline = Duration.ofMinutes(60);
    }

    @Data
    public static class RunConfig {

        /**
         * Number of categories running at the same time
         */
        private int parallelism = 1;
    }
}
