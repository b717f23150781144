package win.ixuni.s3probe.core.orchestrator;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3probe.core.check.CheckResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of all categories of one run
 */
@Value
@Builder
public class RunSummary {

    int totalCategories;

    int totalChecks;

    int totalPassed;

    int totalFailed;

    /**
     * Percentage, 0 when no check ran
     */
    double overallSuccessRate;

    /**
     * Seconds from the first category start to the last category end
     */
    double overallDuration;

    List<String> executedCategories;

    /**
     * Category name to result, in run order
     */
    Map<String, CategoryResult> results;

    Instant startedAt;

    Instant finishedAt;

    public static RunSummary of(List<CategoryResult> categoryResults, Instant startedAt, Instant finishedAt) {
        int totalChecks = 0;
        int totalPassed = 0;
        Map<String, CategoryResult> results = new LinkedHashMap<>();
        for (CategoryResult result : categoryResults) {
            totalChecks += result.getSummary().getTotal();
            totalPassed += result.getSummary().getPassed();
            results.put(result.getCategory(), result);
        }
        double rate = totalChecks > 0 ? (double) totalPassed / totalChecks * 100.0 : 0.0;
        return RunSummary.builder()
                .totalCategories(categoryResults.size())
                .totalChecks(totalChecks)
                .totalPassed(totalPassed)
                .totalFailed(totalChecks - totalPassed)
                .overallSuccessRate(rate)
                .overallDuration(Duration.between(startedAt, finishedAt).toMillis() / 1000.0)
                .executedCategories(List.copyOf(results.keySet()))
                .results(Collections.unmodifiableMap(results))
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    /**
     * All failing checks across categories, in run order
     */
    public List<FailedCheck> failedChecks() {
        List<FailedCheck> failed = new ArrayList<>();
        for (CategoryResult categoryResult : results.values()) {
            if (categoryResult.getError() != null && categoryResult.getResults().isEmpty()) {
                failed.add(new FailedCheck(categoryResult.getCategory(), categoryResult.getCategory(),
                        categoryResult.getError(), Map.of(), categoryResult.getDuration()));
            }
            for (CheckResult result : categoryResult.getResults()) {
                if (!result.isSuccess()) {
                    failed.add(new FailedCheck(categoryResult.getCategory(), result.getName(),
                            result.getMessage(), result.getDetails(), result.getDuration()));
                }
            }
        }
        return failed;
    }

    public boolean isAllPassed() {
        return totalFailed == 0 && results.values().stream().allMatch(result -> result.getError() == null);
    }
}
