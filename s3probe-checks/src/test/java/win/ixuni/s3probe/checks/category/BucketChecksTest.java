package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BucketChecksTest {

    @Test
    @DisplayName("Bucket lifecycle probes pass and secondary buckets are removed")
    void bucketLifecyclePassesOnMemory() {
        MemoryStorageGateway gateway = MemoryCheckFixture.newGateway();
        BucketChecks checks = new BucketChecks(MemoryCheckFixture.context(gateway, BucketChecks.NAME));

        List<CheckResult> results = checks.runChecks();

        for (String name : List.of("bucket_creation", "bucket_creation_invalid_name", "bucket_listing",
                "bucket_head_existing", "bucket_head_nonexistent", "bucket_versioning_default",
                "bucket_versioning_enable", "bucket_tagging_put_get", "bucket_tagging_delete",
                "bucket_deletion_empty", "bucket_deletion_nonexistent")) {
            MemoryCheckFixture.assertPassed(results, name);
        }
        assertFalse(gateway.getStore().getBuckets().containsKey(BucketChecks.INVALID_BUCKET_NAME));

        assertEquals(List.of(), checks.cleanup());
        assertTrue(gateway.getStore().getBuckets().isEmpty());
        gateway.close();
    }
}
