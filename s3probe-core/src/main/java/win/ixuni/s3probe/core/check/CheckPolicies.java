package win.ixuni.s3probe.core.check;

import java.util.Arrays;

/**
 * Pass/fail constants shared by the probes. Thresholds are fractions of fields that must survive
 * a round trip unchanged.
 */
public final class CheckPolicies {

    private CheckPolicies() {
    }

    // ==================== Thresholds ====================

    public static final double STANDARD_HEADERS_THRESHOLD = 0.8;

    public static final double CUSTOM_METADATA_THRESHOLD = 0.9;

    public static final double ENCODED_METADATA_THRESHOLD = 0.7;

    public static final double CASE_PRESERVATION_THRESHOLD = 0.5;

    public static final double COPY_PRESERVATION_THRESHOLD = 0.8;

    // ==================== Accepted rejection statuses ====================

    public static final int[] VALIDATION_ERROR = {400, 403};

    public static final int[] NOT_FOUND = {404};

    public static final int[] CONFLICT = {409};

    /**
     * Graceful refusal of an optional feature
     */
    public static final int[] NOT_SUPPORTED = {400, 501};

    public static final int[] TOO_LARGE = {400, 413};

    /**
     * True when {@code preserved / total} reaches {@code threshold}. Nothing to compare never passes.
     */
    public static boolean meetsThreshold(int preserved, int total, double threshold) {
        if (total <= 0) {
            return false;
        }
        return (double) preserved / total >= threshold;
    }

    public static double ratio(int preserved, int total) {
        return total > 0 ? (double) preserved / total : 0.0;
    }

    public static boolean contains(int[] statuses, int status) {
        return Arrays.stream(statuses).anyMatch(candidate -> candidate == status);
    }

    public static String describe(int[] statuses) {
        return Arrays.toString(statuses);
    }
}
