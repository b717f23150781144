package win.ixuni.s3probe.core.check;

import java.util.List;

/**
 * A group of related probes sharing one scoped bucket and one cleanup pass.
 * <p>
 * Instances are single-use: construct, {@link #runChecks()}, {@link #cleanup()}, discard.
 */
public interface CheckCategory {

    /**
     * @return category name, e.g. "objects"
     */
    String getName();

    /**
     * Provision the scoped bucket and run every probe in order.
     * When the bucket cannot be created the result list holds a single failure and no probe runs.
     *
     * @return results in probe order
     */
    List<CheckResult> runChecks();

    /**
     * Tear down every resource the run created
     *
     * @return teardown failures, reported as warnings
     */
    List<CleanupError> cleanup();

    CategorySummary getSummary();
}
