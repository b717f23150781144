package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 put object handler
 * <p>
 * Sends the whole body in one request with an explicit content length.
 */
public class S3PutObjectHandler extends AbstractS3Handler<PutObjectOperation, StoredObject> {

    @Override
    protected Mono<StoredObject> doHandle(PutObjectOperation operation, S3GatewayContext context) {
        byte[] data = operation.getContent() != null ? operation.getContent() : new byte[0];

        var requestBuilder = PutObjectRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .contentType(operation.getContentType())
                .contentEncoding(operation.getContentEncoding())
                .contentDisposition(operation.getContentDisposition())
                .contentLanguage(operation.getContentLanguage())
                .cacheControl(operation.getCacheControl())
                .expires(operation.getExpires())
                .contentLength((long) data.length);

        if (operation.getMetadata() != null && !operation.getMetadata().isEmpty()) {
            requestBuilder.metadata(operation.getMetadata());
        }

        return Mono.fromFuture(() -> context.getS3Client().putObject(
                        requestBuilder.build(),
                        AsyncRequestBody.fromBytes(data)))
                .map(response -> StoredObject.builder()
                        .bucketName(operation.getBucketName())
                        .key(operation.getKey())
                        .etag(response.eTag())
                        .versionId(response.versionId())
                        .size((long) data.length)
                        .build());
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
