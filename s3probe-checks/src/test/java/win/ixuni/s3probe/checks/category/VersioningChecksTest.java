package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.s3probe.core.operation.bucket.GetBucketVersioningOperation;
import win.ixuni.s3probe.core.operation.bucket.PutBucketVersioningOperation;
import win.ixuni.s3probe.core.operation.object.DeleteObjectOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class VersioningChecksTest {

    @Test
    @DisplayName("Versions are created, listed, read back and deleted")
    void versionLifecyclePassesOnMemory() {
        MemoryStorageGateway gateway = MemoryCheckFixture.newGateway();
        VersioningChecks checks = new VersioningChecks(MemoryCheckFixture.context(gateway, VersioningChecks.NAME));
        try {
            List<CheckResult> results = checks.runChecks();

            for (String name : List.of("versioning_default_disabled", "versioning_enable",
                    "versioning_create_version_1", "versioning_create_version_2", "versioning_create_version_3",
                    "versioning_list_versions", "versioning_get_version_1", "versioning_get_version_2",
                    "versioning_get_version_3", "versioning_delete_version", "versioning_delete_verification")) {
                MemoryCheckFixture.assertPassed(results, name);
            }
        } finally {
            assertEquals(List.of(), checks.cleanup());
            gateway.close();
        }
    }

    @Test
    @DisplayName("A put without a version id fails creation and skips the version-specific probes")
    void missingVersionIdFails() {
        StorageGateway gateway = mock(StorageGateway.class);
        when(gateway.createBucket(any(CreateBucketOperation.class))).thenReturn(GatewayResult.success(null));
        when(gateway.getBucketVersioning(any(GetBucketVersioningOperation.class)))
                .thenReturn(GatewayResult.success(null), GatewayResult.success("Enabled"));
        when(gateway.putBucketVersioning(any(PutBucketVersioningOperation.class)))
                .thenReturn(GatewayResult.success(null));
        when(gateway.putObject(any(PutObjectOperation.class)))
                .thenReturn(GatewayResult.success(StoredObject.builder().etag("\"e\"").versionId("null").build()));
        VersioningChecks checks = new VersioningChecks(MemoryCheckFixture.context(gateway, VersioningChecks.NAME));

        List<CheckResult> results = checks.runChecks();

        MemoryCheckFixture.assertPassed(results, "versioning_default_disabled");
        MemoryCheckFixture.assertFailed(results, "versioning_create_version_1");
        MemoryCheckFixture.assertFailed(results, "versioning_list_versions");
        MemoryCheckFixture.assertFailed(results, "versioning_get_version");
        verify(gateway, never()).listObjectVersions(any());
    }

    @Test
    @DisplayName("Repeated unversioned puts of one key queue a single object deletion")
    void unversionedPutsCleanedUpOnce() {
        StorageGateway gateway = mock(StorageGateway.class);
        when(gateway.createBucket(any(CreateBucketOperation.class))).thenReturn(GatewayResult.success(null));
        when(gateway.getBucketVersioning(any(GetBucketVersioningOperation.class)))
                .thenReturn(GatewayResult.success(null), GatewayResult.success("Enabled"));
        when(gateway.putBucketVersioning(any(PutBucketVersioningOperation.class)))
                .thenReturn(GatewayResult.success(null));
        when(gateway.putObject(any(PutObjectOperation.class)))
                .thenReturn(GatewayResult.success(StoredObject.builder().etag("\"e\"").build()));
        when(gateway.deleteObject(any(DeleteObjectOperation.class))).thenReturn(GatewayResult.success(null));
        when(gateway.deleteBucket(any(DeleteBucketOperation.class))).thenReturn(GatewayResult.success(null));
        VersioningChecks checks = new VersioningChecks(MemoryCheckFixture.context(gateway, VersioningChecks.NAME));

        List<CheckResult> results = checks.runChecks();
        checks.cleanup();

        for (int number = 1; number <= 3; number++) {
            MemoryCheckFixture.assertFailed(results, "versioning_create_version_" + number);
        }
        verify(gateway, times(1)).deleteObject(argThat(operation -> operation.getVersionId() == null));
    }
}
