package win.ixuni.s3probe.core.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProbeConfigValidatorTest {

    private static final List<String> CATEGORIES = List.of("buckets", "objects");

    private ProbeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ProbeProperties();
        properties.getConnection().setEndpointUrl("https://s3.example.com");
        properties.getConnection().setAccessKey("AKIAEXAMPLE");
        properties.getConnection().setSecretKey("secret");
        properties.getConnection().setVerifySsl(true);
    }

    @Test
    @DisplayName("Complete S3 configuration is valid without warnings")
    void valid() {
        ProbeConfigValidator.Report report = ProbeConfigValidator.validate(properties, CATEGORIES);

        assertTrue(report.isValid(), () -> report.errors().toString());
        assertEquals(List.of(), report.warnings());
    }

    @Test
    @DisplayName("Endpoint must be an http(s) URL")
    void endpointScheme() {
        properties.getConnection().setEndpointUrl("s3.example.com");

        assertFalse(ProbeConfigValidator.validate(properties, CATEGORIES).isValid());
    }

    @Test
    @DisplayName("Credentials are required for the S3 gateway")
    void credentials() {
        properties.getConnection().setSecretKey(" ");

        ProbeConfigValidator.Report report = ProbeConfigValidator.validate(properties, CATEGORIES);

        assertFalse(report.isValid());
        assertTrue(report.errors().stream().anyMatch(error -> error.contains("secret-key")));
    }

    @Test
    @DisplayName("Placeholders, localhost and disabled TLS verification are warnings")
    void warnings() {
        properties.getConnection().setEndpointUrl("http://localhost:9000");
        properties.getConnection().setAccessKey(ProbeConfigValidator.PLACEHOLDER_ACCESS_KEY);
        properties.getConnection().setVerifySsl(false);

        ProbeConfigValidator.Report report = ProbeConfigValidator.validate(properties, CATEGORIES);

        assertTrue(report.isValid());
        assertEquals(3, report.warnings().size());
    }

    @Test
    @DisplayName("At least one category must stay enabled")
    void allDisabled() {
        properties.setChecks(Map.of("buckets", false, "objects", false));

        assertFalse(ProbeConfigValidator.validate(properties, CATEGORIES).isValid());
    }

    @Test
    @DisplayName("Unknown category names in the configuration are warnings")
    void unknownCategory() {
        properties.setChecks(Map.of("bukets", true));

        ProbeConfigValidator.Report report = ProbeConfigValidator.validate(properties, CATEGORIES);

        assertTrue(report.isValid());
        assertTrue(report.warnings().get(0).contains("bukets"));
    }

    @Test
    @DisplayName("The memory gateway needs no connection settings")
    void memoryGateway() {
        properties.getGateway().setType("memory");
        properties.getConnection().setAccessKey(null);
        properties.getConnection().setEndpointUrl(null);

        assertTrue(ProbeConfigValidator.validate(properties, CATEGORIES).isValid());
    }
}
