package win.ixuni.s3probe.runner.report;

import win.ixuni.s3probe.core.check.CategorySummary;
import win.ixuni.s3probe.core.orchestrator.CategoryResult;
import win.ixuni.s3probe.core.orchestrator.FailedCheck;
import win.ixuni.s3probe.core.orchestrator.RunSummary;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text run report: totals, one line per category, then every failing check
 */
public final class TextReportFormatter {

    private static final String RULE = "=".repeat(60);
    private static final String SEPARATOR = "-".repeat(40);

    private TextReportFormatter() {
    }

    public static String format(RunSummary summary) {
        if (summary == null) {
            return "No check results available";
        }
        StringBuilder report = new StringBuilder();
        line(report, RULE);
        line(report, "S3 COMPATIBILITY CHECK SUMMARY");
        line(report, RULE);
        line(report, "");
        line(report, "Total Categories: " + summary.getTotalCategories());
        line(report, "Total Checks: " + summary.getTotalChecks());
        line(report, "Passed: " + summary.getTotalPassed());
        line(report, "Failed: " + summary.getTotalFailed());
        line(report, String.format(Locale.ROOT, "Success Rate: %.1f%%", summary.getOverallSuccessRate()));
        line(report, String.format(Locale.ROOT, "Duration: %.2fs", summary.getOverallDuration()));
        line(report, "");

        line(report, "CATEGORY RESULTS:");
        line(report, SEPARATOR);
        for (CategoryResult result : summary.getResults().values()) {
            CategorySummary counts = result.getSummary();
            boolean clean = counts.getFailed() == 0 && result.getError() == null;
            line(report, String.format(Locale.ROOT, "%s %s: %d/%d (%.1f%%) [%.2fs]",
                    clean ? "✓" : "✗", result.getCategory(), counts.getPassed(), counts.getTotal(),
                    counts.getSuccessRate(), result.getDuration()));
            if (!result.getCleanupErrors().isEmpty()) {
                line(report, "  Cleanup left " + result.getCleanupErrors().size() + " resource(s) behind");
            }
        }
        line(report, "");

        List<FailedCheck> failed = summary.failedChecks();
        if (failed.isEmpty()) {
            line(report, "All checks passed!");
        } else {
            line(report, "FAILED CHECKS:");
            line(report, SEPARATOR);
            for (FailedCheck check : failed) {
                line(report, "✗ " + check.getCategory() + "." + check.getCheckName());
                line(report, "  Message: " + check.getMessage());
                if (!check.getDetails().isEmpty()) {
                    line(report, "  Details: " + check.getDetails());
                }
                line(report, "");
            }
        }
        report.append(RULE);
        return report.toString();
    }

    /**
     * One-line verdict printed after the report, also in quiet mode
     */
    public static String verdict(RunSummary summary) {
        if (summary.getTotalFailed() == 0) {
            return String.format(Locale.ROOT, "✓ All %d checks passed (%.1f%%)",
                    summary.getTotalChecks(), summary.getOverallSuccessRate());
        }
        return String.format(Locale.ROOT, "✗ %d/%d checks failed (%.1f%%)",
                summary.getTotalFailed(), summary.getTotalChecks(), summary.getOverallSuccessRate());
    }

    private static void line(StringBuilder report, String text) {
        report.append(text).append('\n');
    }
}
