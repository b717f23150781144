package win.ixuni.s3probe.core.gateway;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.model.*;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.Operation;
import win.ixuni.s3probe.core.operation.OperationHandlerRegistry;
import win.ixuni.s3probe.core.operation.bucket.*;
import win.ixuni.s3probe.core.operation.multipart.*;
import win.ixuni.s3probe.core.operation.object.*;

import java.util.List;
import java.util.Map;

/**
 * Base class for gateways built on the operation handler registry.
 * <p>
 * Subclasses register their handlers and interceptors; every verb is dispatched through
 * {@link #execute(Operation)}, which blocks on the reactive result and normalizes any failure to a
 * {@link GatewayError}.
 */
@Slf4j
public abstract class AbstractStorageGateway implements StorageGateway {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected abstract GatewayContext getGatewayContext();

    /**
     * Execute an operation and wait for its outcome
     */
    public <R> GatewayResult<R> execute(Operation<R> operation) {
        try {
            R value = handlerRegistry.execute(operation, getGatewayContext()).block();
            return GatewayResult.success(value);
        } catch (RuntimeException e) {
            return GatewayResult.failure(toGatewayError(operation, Exceptions.unwrap(e)));
        }
    }

    private GatewayError toGatewayError(Operation<?> operation, Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException.toError();
        }
        // Interceptors translate backend errors; anything reaching here never got a response
        log.debug("Untranslated failure in {}: {}", operation.getOperationName(), error.toString());
        return GatewayException.clientFailure(error).toError();
    }

    // ==================== Bucket ====================

    @Override
    public GatewayResult<Void> createBucket(CreateBucketOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> deleteBucket(DeleteBucketOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> headBucket(HeadBucketOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<List<BucketInfo>> listBuckets(ListBucketsOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<String> getBucketVersioning(GetBucketVersioningOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> putBucketVersioning(PutBucketVersioningOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Map<String, String>> getBucketTagging(GetBucketTaggingOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> putBucketTagging(PutBucketTaggingOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> deleteBucketTagging(DeleteBucketTaggingOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<String> getBucketPolicy(GetBucketPolicyOperation operation) {
        return execute(operation);
    }

    // ==================== Object ====================

    @Override
    public GatewayResult<StoredObject> putObject(PutObjectOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<ObjectContent> getObject(GetObjectOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<ObjectMetadata> headObject(HeadObjectOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> deleteObject(DeleteObjectOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<StoredObject> copyObject(CopyObjectOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<ListObjectsResult> listObjects(ListObjectsOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<ListObjectsResult> listObjectsV2(ListObjectsV2Operation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<List<ObjectVersion>> listObjectVersions(ListObjectVersionsOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Map<String, String>> getObjectTagging(GetObjectTaggingOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> putObjectTagging(PutObjectTaggingOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> deleteObjectTagging(DeleteObjectTaggingOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<ObjectAttributes> getObjectAttributes(GetObjectAttributesOperation operation) {
        return execute(operation);
    }

    // ==================== Multipart ====================

    @Override
    public GatewayResult<MultipartUpload> createMultipartUpload(CreateMultipartUploadOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<UploadedPart> uploadPart(UploadPartOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<StoredObject> completeMultipartUpload(CompleteMultipartUploadOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<Void> abortMultipartUpload(AbortMultipartUploadOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<List<MultipartUpload>> listMultipartUploads(ListMultipartUploadsOperation operation) {
        return execute(operation);
    }

    @Override
    public GatewayResult<List<UploadedPart>> listParts(ListPartsOperation operation) {
        return execute(operation);
    }
}
