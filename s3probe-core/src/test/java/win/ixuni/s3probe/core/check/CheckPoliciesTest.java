package win.ixuni.s3probe.core.check;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CheckPoliciesTest {

    @Test
    @DisplayName("8 of 10 meets a 0.8 threshold, 7 of 10 does not")
    void thresholdBoundary() {
        assertTrue(CheckPolicies.meetsThreshold(8, 10, CheckPolicies.COPY_PRESERVATION_THRESHOLD));
        assertFalse(CheckPolicies.meetsThreshold(7, 10, CheckPolicies.COPY_PRESERVATION_THRESHOLD));
    }

    @Test
    @DisplayName("Nothing to compare never meets a threshold")
    void emptyNeverPasses() {
        assertFalse(CheckPolicies.meetsThreshold(0, 0, CheckPolicies.CASE_PRESERVATION_THRESHOLD));
        assertEquals(0.0, CheckPolicies.ratio(0, 0));
    }

    @Test
    @DisplayName("Accepted status sets")
    void statusSets() {
        assertTrue(CheckPolicies.contains(CheckPolicies.VALIDATION_ERROR, 403));
        assertFalse(CheckPolicies.contains(CheckPolicies.VALIDATION_ERROR, 404));
        assertTrue(CheckPolicies.contains(CheckPolicies.NOT_SUPPORTED, 501));
        assertTrue(CheckPolicies.contains(CheckPolicies.TOO_LARGE, 413));
        assertEquals("[400, 413]", CheckPolicies.describe(CheckPolicies.TOO_LARGE));
    }
}
