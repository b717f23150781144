package win.ixuni.s3probe.gateway.s3.handler.multipart;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.multipart.CompleteMultipartUploadOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.List;

/**
 * S3 complete multipart upload handler
 * <p>
 * Parts are passed through as given, so that ordering and ETag mistakes reach the backend.
 */
public class S3CompleteMultipartUploadHandler
        extends AbstractS3Handler<CompleteMultipartUploadOperation, StoredObject> {

    @Override
    protected Mono<StoredObject> doHandle(CompleteMultipartUploadOperation operation, S3GatewayContext context) {
        List<CompletedPart> completedParts = operation.getParts() == null ? List.of() : operation.getParts().stream()
                .map(p -> CompletedPart.builder()
                        .partNumber(p.getPartNumber())
                        .eTag(p.getEtag())
                        .build())
                .toList();

        var request = CompleteMultipartUploadRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .uploadId(operation.getUploadId())
                .multipartUpload(CompletedMultipartUpload.builder()
                        .parts(completedParts)
                        .build())
                .build();

        return Mono.fromFuture(() -> context.getS3Client().completeMultipartUpload(request))
                .map(response -> StoredObject.builder()
                        .bucketName(operation.getBucketName())
                        .key(operation.getKey())
                        .etag(response.eTag())
                        .versionId(response.versionId())
                        .build());
    }

    @Override
    public Class<CompleteMultipartUploadOperation> getOperationType() {
        return CompleteMultipartUploadOperation.class;
    }
}
