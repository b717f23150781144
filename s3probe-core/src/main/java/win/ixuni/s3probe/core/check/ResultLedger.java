package win.ixuni.s3probe.core.check;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only, ordered record of the results of one category run.
 * Aggregates are computed from the results on every call.
 */
public class ResultLedger {

    private final String category;
    private final List<CheckResult> results = new ArrayList<>();

    public ResultLedger(String category) {
        this.category = category;
    }

    public void append(CheckResult result) {
        results.add(result);
    }

    /**
     * @return read-only view in append order
     */
    public List<CheckResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public int getTotal() {
        return results.size();
    }

    public int getPassed() {
        return (int) results.stream().filter(CheckResult::isSuccess).count();
    }

    public int getFailed() {
        return getTotal() - getPassed();
    }

    public double getSuccessRate() {
        return summarize().getSuccessRate();
    }

    public CategorySummary summarize() {
        return CategorySummary.of(category, getTotal(), getPassed());
    }
}
