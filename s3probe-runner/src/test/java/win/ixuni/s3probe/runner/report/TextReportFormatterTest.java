package win.ixuni.s3probe.runner.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.core.check.CategorySummary;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.orchestrator.CategoryResult;
import win.ixuni.s3probe.core.orchestrator.RunSummary;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TextReportFormatterTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    static RunSummary sampleSummary() {
        CategoryResult objects = CategoryResult.builder()
                .category("objects")
                .summary(CategorySummary.of("objects", 2, 1))
                .results(List.of(
                        CheckResult.pass("object_upload", "Uploaded", Map.of(), 0.1),
                        CheckResult.fail("object_download", "Content mismatch", Map.of("expected_size", 1024), 0.2)))
                .duration(0.5)
                .build();
        CategoryResult tagging = CategoryResult.builder()
                .category("tagging")
                .summary(CategorySummary.of("tagging", 1, 1))
                .results(List.of(CheckResult.pass("object_tagging", "Tags match", Map.of(), 0.1)))
                .duration(0.2)
                .build();
        return RunSummary.of(List.of(objects, tagging), START, START.plusMillis(1500));
    }

    @Test
    @DisplayName("Report lists totals, categories and failures")
    void report() {
        String report = TextReportFormatter.format(sampleSummary());

        assertTrue(report.contains("Total Checks: 3"));
        assertTrue(report.contains("Success Rate: 66.7%"));
        assertTrue(report.contains("Duration: 1.50s"));
        assertTrue(report.contains("✗ objects: 1/2 (50.0%) [0.50s]"));
        assertTrue(report.contains("✓ tagging: 1/1 (100.0%) [0.20s]"));
        assertTrue(report.contains("✗ objects.object_download"));
        assertTrue(report.contains("  Message: Content mismatch"));
        assertTrue(report.contains("expected_size=1024"));
    }

    @Test
    void allPassed() {
        CategoryResult tagging = CategoryResult.builder()
                .category("tagging")
                .summary(CategorySummary.of("tagging", 1, 1))
                .results(List.of(CheckResult.pass("object_tagging", "ok", Map.of(), 0.1)))
                .build();
        RunSummary summary = RunSummary.of(List.of(tagging), START, START);

        assertTrue(TextReportFormatter.format(summary).contains("All checks passed!"));
        assertEquals("✓ All 1 checks passed (100.0%)", TextReportFormatter.verdict(summary));
    }

    @Test
    @DisplayName("A faulted category shows its error as a failed check")
    void faultedCategory() {
        RunSummary summary = RunSummary.of(
                List.of(CategoryResult.faulted("sync", "IllegalStateException: boom", 0.0)), START, START);

        String report = TextReportFormatter.format(summary);

        assertTrue(report.contains("✗ sync: 0/0"));
        assertTrue(report.contains("Message: IllegalStateException: boom"));
    }

    @Test
    void verdictOnFailure() {
        assertEquals("✗ 1/3 checks failed (66.7%)", TextReportFormatter.verdict(sampleSummary()));
    }
}
