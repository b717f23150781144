package win.ixuni.s3probe.core.check;

import lombok.Value;

/**
 * Pass/fail counts of one category
 */
@Value
public class CategorySummary {

    String category;

    int total;

    int passed;

    int failed;

    /**
     * Percentage of passed checks, 0 when nothing ran
     */
    double successRate;

    public static CategorySummary of(String category, int total, int passed) {
        double rate = total > 0 ? (double) passed / total * 100.0 : 0.0;
        return new CategorySummary(category, total, passed, total - passed, rate);
    }

    public static CategorySummary empty(String category) {
        return of(category, 0, 0);
    }
}
