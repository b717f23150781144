package win.ixuni.s3probe.core.check;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CheckResultTest {

    @Test
    @DisplayName("Details are copied and read-only")
    void detailsAreSnapshotted() {
        Map<String, Object> details = new HashMap<>();
        details.put("size", 10);
        CheckResult result = CheckResult.pass("object_upload", "ok", details, 0.5);

        details.put("size", 20);

        assertEquals(10, result.getDetails().get("size"));
        assertThrows(UnsupportedOperationException.class, () -> result.getDetails().put("x", 1));
    }

    @Test
    @DisplayName("Null details become an empty map")
    void nullDetails() {
        CheckResult result = CheckResult.fail("object_upload", "failed", null, 0.0);

        assertFalse(result.isSuccess());
        assertTrue(result.getDetails().isEmpty());
        assertNotNull(result.getTimestamp());
    }
}
