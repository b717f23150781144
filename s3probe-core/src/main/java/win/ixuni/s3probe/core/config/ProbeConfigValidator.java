package win.ixuni.s3probe.core.config;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Validates {@link ProbeProperties} before a run.
 * <p>
 * Errors make the run impossible; warnings are logged and the run proceeds.
 */
public final class ProbeConfigValidator {

    static final String PLACEHOLDER_ACCESS_KEY = "your-access-key-here";
    static final String PLACEHOLDER_SECRET_KEY = "your-secret-key-here";

    private ProbeConfigValidator() {
    }

    public record Report(List<String> errors, List<String> warnings) {

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    /**
     * @param properties     configuration to check
     * @param categoryNames  categories known to the catalog
     */
    public static Report validate(ProbeProperties properties, Collection<String> categoryNames) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (categoryNames.stream().noneMatch(properties::isCategoryEnabled)) {
            errors.add("At least one check category must be enabled under s3probe.checks");
        }
        for (String configured : properties.getChecks().keySet()) {
            if (!categoryNames.contains(configured)) {
                warnings.add("Unknown check category in configuration: " + configured);
            }
        }

        ProbeProperties.TestDataConfig testData = properties.getTestData();
        if (testData.getMultipartChunkSize() < 5 * 1024 * 1024) {
            warnings.add("multipart-chunk-size is below 5 MiB; backends enforcing the S3 minimum part size will reject parts");
        }
        if (testData.getSmallFileSize() < 0 || testData.getMediumFileSize() < 0 || testData.getLargeFileSize() < 0) {
            errors.add("Test file sizes must not be negative");
        }

        if (!"s3".equalsIgnoreCase(properties.getGateway().getType())) {
            return new Report(List.copyOf(errors), List.copyOf(warnings));
        }

        ProbeProperties.ConnectionConfig connection = properties.getConnection();
        String endpoint = connection.getEndpointUrl();
        if (endpoint == null || !(endpoint.startsWith("http://") || endpoint.startsWith("https://"))) {
            errors.add("endpoint-url must start with http:// or https://");
        } else {
            try {
                String host = URI.create(endpoint).getHost();
                if ("localhost".equalsIgnoreCase(host) || "127.0.0.1".equals(host)) {
                    warnings.add("Using localhost endpoint - ensure the S3 service is running locally");
                }
            } catch (IllegalArgumentException e) {
                errors.add("endpoint-url is not a valid URI: " + e.getMessage());
            }
        }
        if (isBlank(connection.getAccessKey()) || isBlank(connection.getSecretKey())) {
            errors.add("access-key and secret-key must be configured");
        }
        if (PLACEHOLDER_ACCESS_KEY.equals(connection.getAccessKey())) {
            warnings.add("Access key appears to be a placeholder value");
        }
        if (PLACEHOLDER_SECRET_KEY.equals(connection.getSecretKey())) {
            warnings.add("Secret key appears to be a placeholder value");
        }
        if (!connection.isVerifySsl()) {
            warnings.add("SSL verification is disabled - use only for testing");
        }
        return new Report(List.copyOf(errors), List.copyOf(warnings));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
