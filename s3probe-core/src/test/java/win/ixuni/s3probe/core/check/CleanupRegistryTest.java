package win.ixuni.s3probe.core.check;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.slf4j.LoggerFactory;
import win.ixuni.s3probe.core.gateway.GatewayError;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.model.ObjectSummary;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.s3probe.core.operation.multipart.AbortMultipartUploadOperation;
import win.ixuni.s3probe.core.operation.multipart.ListMultipartUploadsOperation;
import win.ixuni.s3probe.core.operation.object.DeleteObjectOperation;
import win.ixuni.s3probe.core.operation.object.ListObjectVersionsOperation;
import win.ixuni.s3probe.core.operation.object.ListObjectsV2Operation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CleanupRegistryTest {

    private StorageGateway gateway;
    private CleanupRegistry registry;

    @BeforeEach
    void setUp() {
        gateway = mock(StorageGateway.class);
        when(gateway.deleteObject(any(DeleteObjectOperation.class))).thenReturn(GatewayResult.success(null));
        when(gateway.abortMultipartUpload(any(AbortMultipartUploadOperation.class)))
                .thenReturn(GatewayResult.success(null));
        when(gateway.deleteBucket(any(DeleteBucketOperation.class))).thenReturn(GatewayResult.success(null));
        when(gateway.listObjectVersions(any(ListObjectVersionsOperation.class)))
                .thenReturn(GatewayResult.success(List.of()));
        when(gateway.listObjectsV2(any(ListObjectsV2Operation.class)))
                .thenReturn(GatewayResult.success(ListObjectsResult.builder().objects(List.of()).build()));
        when(gateway.listMultipartUploads(any(ListMultipartUploadsOperation.class)))
                .thenReturn(GatewayResult.success(List.of()));
        registry = new CleanupRegistry(gateway, LoggerFactory.getLogger(CleanupRegistryTest.class));
    }

    @Test
    @DisplayName("Drain removes objects, then uploads, then buckets, whatever the registration order")
    void drainsInDependencyOrder() {
        registry.register(CleanupItem.bucket("b"));
        registry.register(CleanupItem.multipartUpload("b", "k2", "u1"));
        registry.register(CleanupItem.object("b", "k1"));

        List<CleanupError> errors = registry.drain();

        assertEquals(List.of(), errors);
        InOrder order = inOrder(gateway);
        order.verify(gateway).deleteObject(new DeleteObjectOperation("b", "k1", null));
        order.verify(gateway).abortMultipartUpload(new AbortMultipartUploadOperation("b", "k2", "u1"));
        order.verify(gateway).deleteBucket(new DeleteBucketOperation("b"));
    }

    @Test
    @DisplayName("Second drain is a no-op")
    void drainIsIdempotent() {
        registry.register(CleanupItem.object("b", "k"));
        registry.drain();

        assertTrue(registry.isEmpty());
        assertEquals(List.of(), registry.drain());
        verify(gateway, times(1)).deleteObject(any());
    }

    @Test
    @DisplayName("A failing item is reported and the remaining items are still processed")
    void failureDoesNotStopDrain() {
        when(gateway.deleteObject(new DeleteObjectOperation("b", "bad", null)))
                .thenReturn(GatewayResult.failure(new GatewayError("AccessDenied", 403, "Access Denied")));
        registry.register(CleanupItem.object("b", "bad"));
        registry.register(CleanupItem.object("b", "good"));
        registry.register(CleanupItem.bucket("b"));

        List<CleanupError> errors = registry.drain();

        assertEquals(1, errors.size());
        assertEquals("AccessDenied", errors.get(0).code());
        assertEquals(403, errors.get(0).httpStatus());
        verify(gateway).deleteObject(new DeleteObjectOperation("b", "good", null));
        verify(gateway).deleteBucket(new DeleteBucketOperation("b"));
    }

    @Test
    @DisplayName("Already deleted resources count as cleaned up")
    void notFoundIsClean() {
        when(gateway.deleteBucket(any(DeleteBucketOperation.class)))
                .thenReturn(GatewayResult.failure(new GatewayError("NoSuchBucket", 404, "gone")));
        registry.register(CleanupItem.bucket("b"));

        assertEquals(List.of(), registry.drain());
    }

    @Test
    @DisplayName("A throwing gateway call becomes a cleanup error")
    void exceptionBecomesError() {
        when(gateway.abortMultipartUpload(any(AbortMultipartUploadOperation.class)))
                .thenThrow(new IllegalStateException("connection reset"));
        registry.register(CleanupItem.multipartUpload("b", "k", "u"));

        List<CleanupError> errors = registry.drain();

        assertEquals(1, errors.size());
        assertEquals("IllegalStateException", errors.get(0).code());
        assertTrue(errors.get(0).toString().contains("multipart upload u"));
    }

    @Test
    @DisplayName("Bucket teardown deletes leftover objects first")
    void bucketIsEmptiedBeforeDeletion() {
        when(gateway.listObjectsV2(any(ListObjectsV2Operation.class)))
                .thenReturn(GatewayResult.success(ListObjectsResult.builder()
                        .objects(List.of(ObjectSummary.builder().key("leftover").build()))
                        .build()));
        registry.register(CleanupItem.bucket("b"));

        registry.drain();

        InOrder order = inOrder(gateway);
        order.verify(gateway).deleteObject(new DeleteObjectOperation("b", "leftover"));
        order.verify(gateway).deleteBucket(new DeleteBucketOperation("b"));
    }

    @Test
    @DisplayName("Forgotten items are not torn down")
    void forget() {
        CleanupItem item = CleanupItem.object("b", "k");
        registry.register(item);

        assertTrue(registry.forget(item));
        assertFalse(registry.forget(item));
        registry.drain();

        verify(gateway, never()).deleteObject(any());
    }
}
