package win.ixuni.s3probe.core.orchestrator;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3probe.core.check.CategorySummary;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.check.CleanupError;

import java.util.List;

/**
 * Outcome of one category within a run
 */
@Value
@Builder
public class CategoryResult {

    String category;

    CategorySummary summary;

    @Builder.Default
    List<CheckResult> results = List.of();

    /**
     * Seconds, including cleanup
     */
    double duration;

    /**
     * Set when the category faulted outside the probe isolation boundary
     */
    String error;

    @Builder.Default
    List<CleanupError> cleanupErrors = List.of();

    /**
     * Zero-result entry for a category that could not run at all
     */
    public static CategoryResult faulted(String category, String error, double duration) {
        return CategoryResult.builder()
                .category(category)
                .summary(CategorySummary.empty(category))
                .duration(duration)
                .error(error)
                .build();
    }
}
