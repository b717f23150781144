package win.ixuni.s3probe.gateway.s3.handler.multipart;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.operation.multipart.CreateMultipartUploadOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.time.Instant;

/**
 * S3 create multipart upload handler
 */
public class S3CreateMultipartUploadHandler
        extends AbstractS3Handler<CreateMultipartUploadOperation, MultipartUpload> {

    @Override
    protected Mono<MultipartUpload> doHandle(CreateMultipartUploadOperation operation, S3GatewayContext context) {
        var requestBuilder = CreateMultipartUploadRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .contentType(operation.getContentType());
        if (operation.getMetadata() != null && !operation.getMetadata().isEmpty()) {
            requestBuilder.metadata(operation.getMetadata());
        }

        return Mono.fromFuture(() -> context.getS3Client().createMultipartUpload(requestBuilder.build()))
                .map(response -> MultipartUpload.builder()
                        .bucketName(operation.getBucketName())
                        .key(operation.getKey())
                        .uploadId(response.uploadId())
                        .initiated(Instant.now())
                        .build());
    }

    @Override
    public Class<CreateMultipartUploadOperation> getOperationType() {
        return CreateMultipartUploadOperation.class;
    }
}
