package win.ixuni.s3probe.gateway.memory.handler.multipart;

import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.operation.multipart.CreateMultipartUploadOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.time.Instant;

/**
 * Memory create multipart upload handler
 */
public class MemoryCreateMultipartUploadHandler
        extends AbstractMemoryHandler<CreateMultipartUploadOperation, MultipartUpload> {

    @Override
    protected MultipartUpload doHandle(CreateMultipartUploadOperation operation, MemoryGatewayContext context) {
        context.requireBucket(operation.getBucketName());
        MemoryGatewayContext.validateKey(operation.getKey());

        String uploadId = context.nextUploadId();
        Instant now = Instant.now();
        context.getMultipartUploads().put(uploadId, MemoryGatewayContext.MultipartState.builder()
                .uploadId(uploadId)
                .bucketName(operation.getBucketName())
                .key(operation.getKey())
                .contentType(operation.getContentType())
                .metadata(MemoryGatewayContext.normalizeMetadata(operation.getMetadata()))
                .initiated(now)
                .build());

        return MultipartUpload.builder()
                .bucketName(operation.getBucketName())
                .key(operation.getKey())
                .uploadId(uploadId)
                .initiated(now)
                .build();
    }

    @Override
    public Class<CreateMultipartUploadOperation> getOperationType() {
        return CreateMultipartUploadOperation.class;
    }
}
