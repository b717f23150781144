package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.gateway.GatewayError;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.ObjectContent;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;
import win.ixuni.s3probe.core.operation.object.GetObjectOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RangeRequestChecksTest {

    @Test
    @DisplayName("Every range probe passes against a store following S3 range semantics")
    void allProbesPassOnMemory() {
        MemoryStorageGateway gateway = MemoryCheckFixture.newGateway();
        RangeRequestChecks checks = new RangeRequestChecks(MemoryCheckFixture.context(gateway, RangeRequestChecks.NAME));
        try {
            List<CheckResult> results = checks.runChecks();

            List<String> failed = results.stream()
                    .filter(result -> !result.isSuccess())
                    .map(result -> result.getName() + ": " + result.getMessage())
                    .toList();
            assertEquals(List.of(), failed);
            MemoryCheckFixture.assertPassed(results, "range_suffix_10000");
            MemoryCheckFixture.assertPassed(results, "range_invalid_end_beyond_size");
            MemoryCheckFixture.assertPassed(results, "range_with_matching_etag");
            MemoryCheckFixture.assertPassed(results, "range_with_nonmatching_etag");
            assertEquals(1 + 4 + 5 + 5 + 3 + 7 + 2, results.size());
        } finally {
            checks.cleanup();
            gateway.close();
        }
    }

    @Test
    @DisplayName("Failed upload of the test object stops the category after one failure")
    void uploadFailureStopsCategory() {
        StorageGateway gateway = mock(StorageGateway.class);
        when(gateway.createBucket(any(CreateBucketOperation.class))).thenReturn(GatewayResult.success(null));
        when(gateway.putObject(any(PutObjectOperation.class)))
                .thenReturn(GatewayResult.failure(new GatewayError("InternalError", 500, "We encountered an internal error")));
        RangeRequestChecks checks = new RangeRequestChecks(MemoryCheckFixture.context(gateway, RangeRequestChecks.NAME));

        List<CheckResult> results = checks.runChecks();

        assertEquals(1, results.size());
        assertEquals("range_test_object_upload", results.get(0).getName());
        verify(gateway, never()).getObject(any());
    }

    @Test
    @DisplayName("Partial content for an invalid range header fails the probe")
    void partialContentForInvalidRangeFails() {
        StorageGateway gateway = mock(StorageGateway.class);
        when(gateway.createBucket(any(CreateBucketOperation.class))).thenReturn(GatewayResult.success(null));
        when(gateway.putObject(any(PutObjectOperation.class)))
                .thenReturn(GatewayResult.success(StoredObject.builder().etag("\"e\"").build()));
        when(gateway.getObject(any(GetObjectOperation.class))).thenReturn(GatewayResult.success(
                ObjectContent.builder().statusCode(206).contentRange("bytes 0-0/10000").data(new byte[1]).build()));
        RangeRequestChecks checks = new RangeRequestChecks(MemoryCheckFixture.context(gateway, RangeRequestChecks.NAME));

        List<CheckResult> results = checks.runChecks();

        MemoryCheckFixture.assertFailed(results, "range_invalid_non_numeric");
        MemoryCheckFixture.assertFailed(results, "range_invalid_end_beyond_size");
        MemoryCheckFixture.assertPassed(results, "range_multi_two_chunks");
    }
}
