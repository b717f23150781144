package win.ixuni.s3probe.gateway.s3.handler.multipart;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import win.ixuni.s3probe.core.operation.multipart.AbortMultipartUploadOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 abort multipart upload handler
 */
public class S3AbortMultipartUploadHandler extends AbstractS3Handler<AbortMultipartUploadOperation, Void> {

    @Override
    protected Mono<Void> doHandle(AbortMultipartUploadOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().abortMultipartUpload(AbortMultipartUploadRequest.builder()
                        .bucket(operation.getBucketName())
                        .key(operation.getKey())
                        .uploadId(operation.getUploadId())
                        .build()))
                .then();
    }

    @Override
    public Class<AbortMultipartUploadOperation> getOperationType() {
        return AbortMultipartUploadOperation.class;
    }
}
