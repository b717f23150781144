package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttributesChecksTest {

    @Test
    @DisplayName("ETag, size, storage class and parts are returned")
    void attributesPassOnMemory() {
        MemoryStorageGateway gateway = MemoryCheckFixture.newGateway();
        AttributesChecks checks = new AttributesChecks(MemoryCheckFixture.context(gateway, AttributesChecks.NAME));
        try {
            List<CheckResult> results = checks.runChecks();

            MemoryCheckFixture.assertPassed(results, "attributes_etag");
            MemoryCheckFixture.assertPassed(results, "attributes_size_and_storage");
            MemoryCheckFixture.assertPassed(results, "attributes_multiple");
            MemoryCheckFixture.assertPassed(results, "attributes_multipart_parts");
        } finally {
            checks.cleanup();
            gateway.close();
        }
    }

    @Test
    @DisplayName("ETags compare without their quotes")
    void unquote() {
        assertEquals("abc", AttributesChecks.unquote("\"abc\""));
        assertEquals("abc", AttributesChecks.unquote("abc"));
        assertNull(AttributesChecks.unquote(null));
    }
}
