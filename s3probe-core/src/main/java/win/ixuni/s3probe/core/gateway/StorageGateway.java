package win.ixuni.s3probe.core.gateway;

import win.ixuni.s3probe.core.model.*;
import win.ixuni.s3probe.core.operation.bucket.*;
import win.ixuni.s3probe.core.operation.multipart.*;
import win.ixuni.s3probe.core.operation.object.*;

import java.util.List;
import java.util.Map;

/**
 * The object-storage API as seen by probes: one method per S3 verb.
 * <p>
 * No method throws for a remote failure. Every outcome is a {@link GatewayResult}: the typed payload,
 * or a {@link GatewayError} with the S3 error code and HTTP status. Retries of transient failures
 * happen inside the gateway and are not visible to callers.
 */
public interface StorageGateway extends AutoCloseable {

    /**
     * @return gateway type identifier, e.g. "s3", "memory"
     */
    String getGatewayType();

    // ==================== Bucket ====================

    GatewayResult<Void> createBucket(CreateBucketOperation operation);

    GatewayResult<Void> deleteBucket(DeleteBucketOperation operation);

    GatewayResult<Void> headBucket(HeadBucketOperation operation);

    GatewayResult<List<BucketInfo>> listBuckets(ListBucketsOperation operation);

    GatewayResult<String> getBucketVersioning(GetBucketVersioningOperation operation);

    GatewayResult<Void> putBucketVersioning(PutBucketVersioningOperation operation);

    GatewayResult<Map<String, String>> getBucketTagging(GetBucketTaggingOperation operation);

    GatewayResult<Void> putBucketTagging(PutBucketTaggingOperation operation);

    GatewayResult<Void> deleteBucketTagging(DeleteBucketTaggingOperation operation);

    GatewayResult<String> getBucketPolicy(GetBucketPolicyOperation operation);

    // ==================== Object ====================

    GatewayResult<StoredObject> putObject(PutObjectOperation operation);

    GatewayResult<ObjectContent> getObject(GetObjectOperation operation);

    GatewayResult<ObjectMetadata> headObject(HeadObjectOperation operation);

    GatewayResult<Void> deleteObject(DeleteObjectOperation operation);

    GatewayResult<StoredObject> copyObject(CopyObjectOperation operation);

    GatewayResult<ListObjectsResult> listObjects(ListObjectsOperation operation);

    GatewayResult<ListObjectsResult> listObjectsV2(ListObjectsV2Operation operation);

    GatewayResult<List<ObjectVersion>> listObjectVersions(ListObjectVersionsOperation operation);

    GatewayResult<Map<String, String>> getObjectTagging(GetObjectTaggingOperation operation);

    GatewayResult<Void> putObjectTagging(PutObjectTaggingOperation operation);

    GatewayResult<Void> deleteObjectTagging(DeleteObjectTaggingOperation operation);

    GatewayResult<ObjectAttributes> getObjectAttributes(GetObjectAttributesOperation operation);

    // ==================== Multipart ====================

    GatewayResult<MultipartUpload> createMultipartUpload(CreateMultipartUploadOperation operation);

    GatewayResult<UploadedPart> uploadPart(UploadPartOperation operation);

    GatewayResult<StoredObject> completeMultipartUpload(CompleteMultipartUploadOperation operation);

    GatewayResult<Void> abortMultipartUpload(AbortMultipartUploadOperation operation);

    GatewayResult<List<MultipartUpload>> listMultipartUploads(ListMultipartUploadsOperation operation);

    GatewayResult<List<UploadedPart>> listParts(ListPartsOperation operation);

    /**
     * Release client resources. Default does nothing.
     */
    @Override
    default void close() {
    }
}
