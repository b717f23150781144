package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.operation.object.HeadObjectOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 head object handler
 */
public class S3HeadObjectHandler extends AbstractS3Handler<HeadObjectOperation, ObjectMetadata> {

    @Override
    protected Mono<ObjectMetadata> doHandle(HeadObjectOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().headObject(HeadObjectRequest.builder()
                        .bucket(operation.getBucketName())
                        .key(operation.getKey())
                        .versionId(operation.getVersionId())
                        .build()))
                .map(response -> toMetadata(operation.getBucketName(), operation.getKey(), response));
    }

    static ObjectMetadata toMetadata(String bucketName, String key, HeadObjectResponse response) {
        return ObjectMetadata.builder()
                .bucketName(bucketName)
                .key(key)
                .contentLength(response.contentLength())
                .etag(response.eTag())
                .contentType(response.contentType())
                .lastModified(response.lastModified())
                .versionId(response.versionId())
                .storageClass(response.storageClassAsString())
                .userMetadata(response.metadata())
                .contentEncoding(response.contentEncoding())
                .contentDisposition(response.contentDisposition())
                .contentLanguage(response.contentLanguage())
                .cacheControl(response.cacheControl())
                .expires(response.expires())
                .build();
    }

    @Override
    public Class<HeadObjectOperation> getOperationType() {
        return HeadObjectOperation.class;
    }
}
