package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorConditionChecksTest {

    private MemoryStorageGateway gateway;
    private ErrorConditionChecks checks;
    private List<CheckResult> results;

    @BeforeEach
    void setUp() {
        gateway = MemoryCheckFixture.newGateway();
        checks = new ErrorConditionChecks(MemoryCheckFixture.context(gateway, ErrorConditionChecks.NAME));
        results = checks.runChecks();
    }

    @AfterEach
    void tearDown() {
        checks.cleanup();
        gateway.close();
    }

    @Test
    @DisplayName("Each invalid bucket name is rejected with a validation error")
    void invalidBucketNamesRejected() {
        for (String suffix : List.of("underscores", "capitals", "trailing_hyphen", "leading_hyphen", "too_long",
                "too_short", "consecutive_dots", "ip_address")) {
            MemoryCheckFixture.assertPassed(results, "invalid_bucket_name_" + suffix);
        }
        assertTrue(gateway.getStore().getBuckets().keySet().stream()
                .allMatch(name -> name.startsWith("probe-test-error-conditions-")));
    }

    @Test
    @DisplayName("Operations on missing buckets and objects report 404")
    void missingResourcesReportNotFound() {
        for (String operation : List.of("head_bucket", "delete_bucket", "put_object", "get_object", "list_objects")) {
            MemoryCheckFixture.assertPassed(results, "nonexistent_bucket_" + operation);
        }
        for (String operation : List.of("get_object", "head_object", "copy_object", "get_object_tagging",
                "delete_object")) {
            MemoryCheckFixture.assertPassed(results, "nonexistent_object_" + operation);
        }
        MemoryCheckFixture.assertPassed(results, "missing_bucket_404");
        MemoryCheckFixture.assertPassed(results, "missing_object_404");
    }

    @Test
    @DisplayName("Malformed requests and conflicts are rejected")
    void malformedAndConflicting() {
        MemoryCheckFixture.assertPassed(results, "malformed_bucket_tagging");
        MemoryCheckFixture.assertPassed(results, "malformed_versioning_config");
        MemoryCheckFixture.assertPassed(results, "invalid_version_id");
        MemoryCheckFixture.assertPassed(results, "large_metadata_limit");
        MemoryCheckFixture.assertPassed(results, "duplicate_bucket_creation");
        MemoryCheckFixture.assertPassed(results, "delete_bucket_with_objects");
        MemoryCheckFixture.assertPassed(results, "bucket_policy_access");
    }

    @Test
    @DisplayName("Invalid keys are refused")
    void invalidKeysRefused() {
        for (String suffix : List.of("empty", "too_long", "null_character", "control_character")) {
            MemoryCheckFixture.assertPassed(results, "invalid_object_key_" + suffix);
        }
    }
}
