package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncChecksTest {

    @Test
    @DisplayName("Batch transfers, directory tree, prefix listing and pagination pass")
    void syncPassesOnMemory() {
        MemoryStorageGateway gateway = MemoryCheckFixture.newGateway();
        SyncChecks checks = new SyncChecks(MemoryCheckFixture.context(gateway, SyncChecks.NAME));
        try {
            List<CheckResult> results = checks.runChecks();

            for (String name : List.of("sync_batch_upload", "sync_directory_structure", "sync_batch_download",
                    "sync_listing_prefix", "sync_listing_pagination")) {
                MemoryCheckFixture.assertPassed(results, name);
            }
            CheckResult prefix = MemoryCheckFixture.find(results, "sync_listing_prefix").orElseThrow();
            assertNotNull(prefix.getDetails());
        } finally {
            checks.cleanup();
            gateway.close();
        }
    }

    @Test
    @DisplayName("The directory tree is deeper than one level")
    void directoryTreeIsNested() {
        assertEquals(8, SyncChecks.DIRECTORY_TREE.size());
        assertTrue(SyncChecks.DIRECTORY_TREE.stream().anyMatch(path -> path.chars().filter(c -> c == '/').count() >= 2));
    }
}
