package win.ixuni.s3probe.core.orchestrator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.core.check.CategorySummary;
import win.ixuni.s3probe.core.check.CheckResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunSummaryTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private static CategoryResult category(String name, int total, int passed) {
        return CategoryResult.builder()
                .category(name)
                .summary(CategorySummary.of(name, total, passed))
                .build();
    }

    @Test
    @DisplayName("Totals add up across categories")
    void aggregates() {
        RunSummary summary = RunSummary.of(List.of(category("buckets", 5, 4), category("objects", 3, 3)),
                START, START.plusMillis(2500));

        assertEquals(2, summary.getTotalCategories());
        assertEquals(8, summary.getTotalChecks());
        assertEquals(7, summary.getTotalPassed());
        assertEquals(1, summary.getTotalFailed());
        assertEquals(87.5, summary.getOverallSuccessRate(), 1e-9);
        assertEquals(2.5, summary.getOverallDuration(), 1e-9);
        assertEquals(List.of("buckets", "objects"), summary.getExecutedCategories());
        assertFalse(summary.isAllPassed());
    }

    @Test
    @DisplayName("No checks gives a 0% success rate")
    void empty() {
        RunSummary summary = RunSummary.of(List.of(), START, START);

        assertEquals(0, summary.getTotalChecks());
        assertEquals(0.0, summary.getOverallSuccessRate());
        assertTrue(summary.isAllPassed());
    }

    @Test
    @DisplayName("Failed checks are flattened with their category, faulted categories included")
    void failedChecks() {
        CategoryResult objects = CategoryResult.builder()
                .category("objects")
                .summary(CategorySummary.of("objects", 2, 1))
                .results(List.of(
                        CheckResult.pass("object_upload_small", "ok", Map.of(), 0.1),
                        CheckResult.fail("object_copy", "Copy failed", Map.of("http_status", 500), 0.2)))
                .build();
        CategoryResult sync = CategoryResult.faulted("sync", "NullPointerException: boom", 0.0);

        List<FailedCheck> failed = RunSummary.of(List.of(objects, sync), START, START).failedChecks();

        assertEquals(2, failed.size());
        assertEquals("objects", failed.get(0).getCategory());
        assertEquals("object_copy", failed.get(0).getCheckName());
        assertEquals("sync", failed.get(1).getCategory());
        assertEquals("NullPointerException: boom", failed.get(1).getMessage());
    }
}
