package win.ixuni.s3probe.gateway.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import win.ixuni.s3probe.core.gateway.GatewayError;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.model.*;
import win.ixuni.s3probe.core.operation.bucket.*;
import win.ixuni.s3probe.core.operation.multipart.*;
import win.ixuni.s3probe.core.operation.object.*;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStorageGatewayTest {

    private static final String BUCKET = "memory-test";
    private static final int PART_SIZE = 5 * 1024 * 1024;

    private MemoryStorageGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new MemoryStorageGateway("unit");
        assertTrue(gateway.createBucket(new CreateBucketOperation(BUCKET)).isSuccess());
    }

    private static byte[] bytes(int size, int seed) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) ((i * 31 + seed) & 0xff);
        }
        return data;
    }

    private StoredObject put(String key, byte[] data) {
        return gateway.putObject(PutObjectOperation.of(BUCKET, key, data)).getValue();
    }

    @Nested
    @DisplayName("Buckets")
    class Buckets {

        @Test
        @DisplayName("Creating an existing bucket is a conflict")
        void duplicate() {
            GatewayError error = gateway.createBucket(new CreateBucketOperation(BUCKET)).getError();

            assertEquals("BucketAlreadyOwnedByYou", error.getCode());
            assertEquals(409, error.getHttpStatus());
        }

        @ParameterizedTest
        @ValueSource(strings = {"ab", "UPPER-case", "under_score", "192.168.1.1", "a..b", "-leading"})
        void invalidNames(String name) {
            assertEquals("InvalidBucketName", gateway.createBucket(new CreateBucketOperation(name)).getError().getCode());
        }

        @Test
        @DisplayName("A bucket holding objects cannot be deleted")
        void notEmpty() {
            put("k", new byte[1]);

            assertEquals(409, gateway.deleteBucket(new DeleteBucketOperation(BUCKET)).getError().getHttpStatus());
            assertTrue(gateway.deleteObject(new DeleteObjectOperation(BUCKET, "k")).isSuccess());
            assertTrue(gateway.deleteBucket(new DeleteBucketOperation(BUCKET)).isSuccess());
            assertTrue(gateway.headBucket(new HeadBucketOperation(BUCKET)).failedWith(404));
        }

        @Test
        void listing() {
            List<BucketInfo> buckets = gateway.listBuckets(new ListBucketsOperation()).getValue();

            assertEquals(1, buckets.size());
            assertEquals(BUCKET, buckets.get(0).getName());
        }
    }

    @Nested
    @DisplayName("Objects")
    class Objects {

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 1024, 1024 * 1024})
        @DisplayName("Content comes back byte for byte")
        void roundTrip(int size) {
            byte[] data = bytes(size, size);
            StoredObject stored = put("obj-" + size, data);

            ObjectContent content = gateway.getObject(GetObjectOperation.of(BUCKET, "obj-" + size)).getValue();

            assertEquals(200, content.getStatusCode());
            assertArrayEquals(data, content.getData());
            assertEquals(MemoryGatewayContext.quotedMd5(data), stored.getEtag());
            assertNull(stored.getVersionId());
        }

        @Test
        @DisplayName("Head reports headers and lower-cased user metadata")
        void head() {
            gateway.putObject(PutObjectOperation.builder()
                    .bucketName(BUCKET)
                    .key("doc.txt")
                    .content(bytes(10, 1))
                    .contentType("text/plain")
                    .cacheControl("max-age=60")
                    .metadata(Map.of("Author", "probe"))
                    .build());

            ObjectMetadata metadata = gateway.headObject(new HeadObjectOperation(BUCKET, "doc.txt")).getValue();

            assertEquals(10L, metadata.getContentLength());
            assertEquals("text/plain", metadata.getContentType());
            assertEquals("max-age=60", metadata.getCacheControl());
            assertEquals(Map.of("author", "probe"), metadata.getUserMetadata());
        }

        @Test
        @DisplayName("Deleting a missing key succeeds")
        void idempotentDelete() {
            assertTrue(gateway.deleteObject(new DeleteObjectOperation(BUCKET, "never-written")).isSuccess());
        }

        @Test
        void missingKey() {
            GatewayResult<ObjectContent> result = gateway.getObject(GetObjectOperation.of(BUCKET, "absent"));

            assertEquals("NoSuchKey", result.getError().getCode());
            assertTrue(gateway.getObject(GetObjectOperation.of("no-such-bucket", "k")).failedWith(404));
        }

        @Test
        @DisplayName("Metadata beyond 2 KB is rejected")
        void metadataTooLarge() {
            GatewayError error = gateway.putObject(PutObjectOperation.builder()
                    .bucketName(BUCKET)
                    .key("big-meta")
                    .metadata(Map.of("blob", "x".repeat(3000)))
                    .build()).getError();

            assertEquals("MetadataTooLarge", error.getCode());
        }

        @Test
        void keyTooLong() {
            assertEquals("KeyTooLongError",
                    gateway.putObject(PutObjectOperation.of(BUCKET, "k".repeat(1025), new byte[0])).getError().getCode());
        }

        @Test
        @DisplayName("Ranges return 206 with the matching slice")
        void range() {
            byte[] data = bytes(1000, 7);
            put("ranged", data);

            ObjectContent content = gateway.getObject(GetObjectOperation.range(BUCKET, "ranged", "bytes=100-199")).getValue();

            assertEquals(206, content.getStatusCode());
            assertEquals("bytes 100-199/1000", content.getContentRange());
            assertArrayEquals(Arrays.copyOfRange(data, 100, 200), content.getData());
            assertTrue(gateway.getObject(GetObjectOperation.range(BUCKET, "ranged", "bytes=5000-")).failedWith(416));
        }

        @Test
        @DisplayName("If-Range with a stale ETag returns the whole object")
        void staleIfRange() {
            put("ranged", bytes(100, 3));

            ObjectContent content = gateway.getObject(GetObjectOperation.builder()
                    .bucketName(BUCKET)
                    .key("ranged")
                    .range("bytes=0-9")
                    .ifRange("\"0123456789abcdef0123456789abcdef\"")
                    .build()).getValue();

            assertEquals(200, content.getStatusCode());
            assertEquals(100, content.getData().length);
        }

        @Test
        void tagging() {
            put("tagged", new byte[1]);
            assertTrue(gateway.putObjectTagging(
                    new PutObjectTaggingOperation(BUCKET, "tagged", Map.of("env", "test"))).isSuccess());

            assertEquals(Map.of("env", "test"),
                    gateway.getObjectTagging(new GetObjectTaggingOperation(BUCKET, "tagged")).getValue());
        }
    }

    @Nested
    @DisplayName("Versioning")
    class Versioning {

        @BeforeEach
        void enable() {
            assertTrue(gateway.putBucketVersioning(new PutBucketVersioningOperation(BUCKET, "Enabled")).isSuccess());
        }

        @Test
        @DisplayName("Each write keeps a distinct version")
        void versions() {
            StoredObject first = put("doc", bytes(10, 1));
            StoredObject second = put("doc", bytes(20, 2));

            assertNotNull(first.getVersionId());
            assertNotEquals(first.getVersionId(), second.getVersionId());
            ObjectContent old = gateway.getObject(GetObjectOperation.builder()
                    .bucketName(BUCKET).key("doc").versionId(first.getVersionId()).build()).getValue();
            assertEquals(10, old.getData().length);
        }

        @Test
        @DisplayName("A plain delete adds a delete marker")
        void deleteMarker() {
            put("doc", bytes(10, 1));
            gateway.deleteObject(new DeleteObjectOperation(BUCKET, "doc"));

            List<ObjectVersion> versions = gateway.listObjectVersions(new ListObjectVersionsOperation(BUCKET, null)).getValue();

            assertEquals(2, versions.size());
            assertTrue(versions.get(0).isDeleteMarker());
            assertTrue(versions.get(0).isLatest());
            assertTrue(gateway.headObject(new HeadObjectOperation(BUCKET, "doc")).failedWith(404));
            assertEquals("Enabled", gateway.getBucketVersioning(new GetBucketVersioningOperation(BUCKET)).getValue());
        }
    }

    @Nested
    @DisplayName("Multipart uploads")
    class Multipart {

        private String start(String key) {
            return gateway.createMultipartUpload(new CreateMultipartUploadOperation(BUCKET, key)).getValue().getUploadId();
        }

        @Test
        @DisplayName("Completed object concatenates the parts with a multipart ETag")
        void complete() {
            String uploadId = start("mp");
            byte[] part1 = bytes(PART_SIZE, 1);
            byte[] part2 = bytes(1000, 2);
            UploadedPart first = gateway.uploadPart(new UploadPartOperation(BUCKET, "mp", uploadId, 1, part1)).getValue();
            UploadedPart second = gateway.uploadPart(new UploadPartOperation(BUCKET, "mp", uploadId, 2, part2)).getValue();

            assertEquals(2, gateway.listParts(new ListPartsOperation(BUCKET, "mp", uploadId)).getValue().size());
            StoredObject stored = gateway.completeMultipartUpload(
                    new CompleteMultipartUploadOperation(BUCKET, "mp", uploadId, List.of(first, second))).getValue();

            assertTrue(stored.getEtag().endsWith("-2\""));
            assertEquals(PART_SIZE + 1000L, stored.getSize());
            assertTrue(gateway.getStore().getMultipartUploads().isEmpty());
        }

        @Test
        @DisplayName("Parts below 5 MiB other than the last are rejected on complete")
        void entityTooSmall() {
            String uploadId = start("small");
            UploadedPart first = gateway.uploadPart(new UploadPartOperation(BUCKET, "small", uploadId, 1, bytes(1024, 1))).getValue();
            UploadedPart second = gateway.uploadPart(new UploadPartOperation(BUCKET, "small", uploadId, 2, bytes(1024, 2))).getValue();

            GatewayError error = gateway.completeMultipartUpload(
                    new CompleteMultipartUploadOperation(BUCKET, "small", uploadId, List.of(first, second))).getError();

            assertEquals("EntityTooSmall", error.getCode());
        }

        @Test
        void partsOutOfOrder() {
            String uploadId = start("order");
            UploadedPart first = gateway.uploadPart(new UploadPartOperation(BUCKET, "order", uploadId, 1, bytes(PART_SIZE, 1))).getValue();
            UploadedPart second = gateway.uploadPart(new UploadPartOperation(BUCKET, "order", uploadId, 2, bytes(10, 2))).getValue();

            assertEquals("InvalidPartOrder", gateway.completeMultipartUpload(
                    new CompleteMultipartUploadOperation(BUCKET, "order", uploadId, List.of(second, first))).getError().getCode());
        }

        @Test
        @DisplayName("Aborted uploads are gone")
        void abort() {
            String uploadId = start("aborted");

            assertTrue(gateway.abortMultipartUpload(new AbortMultipartUploadOperation(BUCKET, "aborted", uploadId)).isSuccess());
            assertEquals("NoSuchUpload", gateway.listParts(new ListPartsOperation(BUCKET, "aborted", uploadId)).getError().getCode());
            assertTrue(gateway.listMultipartUploads(new ListMultipartUploadsOperation(BUCKET, null)).getValue().isEmpty());
        }
    }

    @Test
    @DisplayName("Closing clears the store")
    void close() {
        put("k", new byte[1]);

        gateway.close();

        assertTrue(gateway.getStore().getBuckets().isEmpty());
    }
}
