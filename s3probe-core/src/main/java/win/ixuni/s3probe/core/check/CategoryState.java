package win.ixuni.s3probe.core.check;

/**
 * Lifecycle of one category run
 */
public enum CategoryState {
    UNINITIALIZED,
    BUCKET_PROVISIONED,
    PROBING,
    CLEANING,
    DONE,
    /**
     * The scoped bucket could not be created; the ledger holds a single failure
     */
    DONE_WITH_PARTIAL_RESULTS
}
