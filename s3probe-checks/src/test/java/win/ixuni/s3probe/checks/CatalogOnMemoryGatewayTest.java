package win.ixuni.s3probe.checks;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import win.ixuni.s3probe.core.check.CategoryDefinition;
import win.ixuni.s3probe.core.check.CategorySummary;
import win.ixuni.s3probe.core.check.CheckCategory;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.check.CleanupError;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every category run end to end against the in-memory gateway
 */
class CatalogOnMemoryGatewayTest {

    private MemoryStorageGateway gateway;

    static Stream<CategoryDefinition> categories() {
        return CheckCatalog.categories().stream();
    }

    @BeforeEach
    void setUp() {
        gateway = MemoryCheckFixture.newGateway();
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("categories")
    @DisplayName("Category runs, summarizes its ledger and leaves nothing behind")
    void categoryRunsAndCleansUp(CategoryDefinition definition) {
        CheckCategory category = definition.getFactory()
                .create(MemoryCheckFixture.context(gateway, definition.getName()));

        List<CheckResult> results = category.runChecks();

        assertFalse(results.isEmpty());
        assertTrue(results.stream().noneMatch(result -> result.getName().endsWith("_bucket_setup")),
                "scoped bucket must be provisioned");
        for (CheckResult result : results) {
            assertFalse(result.getName().isBlank());
            assertNotNull(result.getMessage());
            assertTrue(result.getDuration() >= 0.0);
        }

        CategorySummary summary = category.getSummary();
        assertEquals(results.size(), summary.getTotal());
        assertEquals(results.stream().filter(CheckResult::isSuccess).count(), summary.getPassed());
        assertEquals(summary.getTotal(), summary.getPassed() + summary.getFailed());

        List<CleanupError> errors = category.cleanup();
        assertEquals(List.of(), errors);
        assertTrue(gateway.getStore().getBuckets().isEmpty(), "every bucket of the run is deleted");
        assertTrue(gateway.getStore().getMultipartUploads().isEmpty(), "no upload is left in flight");

        assertEquals(List.of(), category.cleanup(), "second cleanup is a no-op");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("categories")
    @DisplayName("Results of a category are returned in probe order and cannot be modified")
    void resultsAreReadOnly(CategoryDefinition definition) {
        CheckCategory category = definition.getFactory()
                .create(MemoryCheckFixture.context(gateway, definition.getName()));
        List<CheckResult> results = category.runChecks();
        try {
            assertThrows(UnsupportedOperationException.class, () -> results.add(results.get(0)));
        } finally {
            category.cleanup();
        }
    }
}
