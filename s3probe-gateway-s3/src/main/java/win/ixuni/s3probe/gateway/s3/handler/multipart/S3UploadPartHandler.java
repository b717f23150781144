package win.ixuni.s3probe.gateway.s3.handler.multipart;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.multipart.UploadPartOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.time.Instant;

/**
 * S3 upload part handler
 */
public class S3UploadPartHandler extends AbstractS3Handler<UploadPartOperation, UploadedPart> {

    @Override
    protected Mono<UploadedPart> doHandle(UploadPartOperation operation, S3GatewayContext context) {
        byte[] data = operation.getContent() != null ? operation.getContent() : new byte[0];
        var request = UploadPartRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .uploadId(operation.getUploadId())
                .partNumber(operation.getPartNumber())
                .contentLength((long) data.length)
                .build();

        return Mono.fromFuture(() -> context.getS3Client().uploadPart(request, AsyncRequestBody.fromBytes(data)))
                .map(response -> UploadedPart.builder()
                        .partNumber(operation.getPartNumber())
                        .etag(response.eTag())
                        .size((long) data.length)
                        .lastModified(Instant.now())
                        .build());
    }

    @Override
    public Class<UploadPartOperation> getOperationType() {
        return UploadPartOperation.class;
    }
}
