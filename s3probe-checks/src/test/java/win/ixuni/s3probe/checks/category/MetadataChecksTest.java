package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetadataChecksTest {

    private MemoryStorageGateway gateway;
    private MetadataChecks checks;
    private List<CheckResult> results;

    @BeforeEach
    void setUp() {
        gateway = MemoryCheckFixture.newGateway();
        checks = new MetadataChecks(MemoryCheckFixture.context(gateway, MetadataChecks.NAME));
        results = checks.runChecks();
    }

    @AfterEach
    void tearDown() {
        checks.cleanup();
        gateway.close();
    }

    @Test
    @DisplayName("Round-trip probes pass against a store that keeps headers and metadata")
    void roundTripsPass() {
        for (String name : List.of("standard_metadata_headers", "custom_metadata_preservation",
                "metadata_encoding_handling", "metadata_copy_preservation", "metadata_copy_replacement",
                "system_user_metadata_distinction", "empty_metadata_values", "no_metadata_baseline")) {
            MemoryCheckFixture.assertPassed(results, name);
        }
    }

    @Test
    @DisplayName("Oversized metadata is rejected")
    void sizeLimitsEnforced() {
        MemoryCheckFixture.assertPassed(results, "large_metadata_value");
        MemoryCheckFixture.assertPassed(results, "total_metadata_size_check");
    }

    @Test
    @DisplayName("Lowercased metadata keys fail the case preservation threshold")
    void casePreservationFailsOnLowercasedKeys() {
        MemoryCheckFixture.assertFailed(results, "metadata_case_preservation");

        CheckResult result = MemoryCheckFixture.find(results, "metadata_case_preservation").orElseThrow();
        assertEquals(List.of("lowercase"), result.getDetails().get("preserved_fields"));
        assertEquals(0.25, (double) result.getDetails().get("success_rate"), 1e-9);
    }

    @Test
    @DisplayName("Preserved fields are those returned with an equal value")
    void preservedComparesValues() {
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("a", "1");
        expected.put("b", "2");
        expected.put("c", "3");
        Map<String, String> actual = Map.of("a", "1", "b", "changed");

        assertEquals(List.of("a"), MetadataChecks.preserved(expected, actual::get));
    }
}
