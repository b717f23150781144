package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaggingChecksTest {

    @Test
    @DisplayName("Bucket and object tag sets round-trip, update and delete")
    void taggingPassesOnMemory() {
        MemoryStorageGateway gateway = MemoryCheckFixture.newGateway();
        TaggingChecks checks = new TaggingChecks(MemoryCheckFixture.context(gateway, TaggingChecks.NAME));
        try {
            List<CheckResult> results = checks.runChecks();

            assertEquals(List.of("bucket_tagging_put_get", "bucket_tagging_delete", "object_tagging_put_get",
                    "object_tagging_update", "object_tagging_delete"),
                    results.stream().map(CheckResult::getName).toList());
            assertTrue(results.stream().allMatch(CheckResult::isSuccess));
        } finally {
            checks.cleanup();
            gateway.close();
        }
    }
}
