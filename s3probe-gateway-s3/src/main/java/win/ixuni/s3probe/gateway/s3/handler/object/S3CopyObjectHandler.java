package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.MetadataDirective;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.object.CopyObjectOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 copy object handler
 */
public class S3CopyObjectHandler extends AbstractS3Handler<CopyObjectOperation, StoredObject> {

    @Override
    protected Mono<StoredObject> doHandle(CopyObjectOperation operation, S3GatewayContext context) {
        var requestBuilder = CopyObjectRequest.builder()
                .sourceBucket(operation.getSourceBucket())
                .sourceKey(operation.getSourceKey())
                .destinationBucket(operation.getDestinationBucket())
                .destinationKey(operation.getDestinationKey());

        if (operation.getMetadataDirective() == CopyObjectOperation.MetadataDirective.REPLACE) {
            requestBuilder.metadataDirective(MetadataDirective.REPLACE)
                    .metadata(operation.getMetadata())
                    .contentType(operation.getContentType());
        }

        return Mono.fromFuture(() -> context.getS3Client().copyObject(requestBuilder.build()))
                .map(response -> StoredObject.builder()
                        .bucketName(operation.getDestinationBucket())
                        .key(operation.getDestinationKey())
                        .etag(response.copyObjectResult() != null ? response.copyObjectResult().eTag() : null)
                        .versionId(response.versionId())
                        .build());
    }

    @Override
    public Class<CopyObjectOperation> getOperationType() {
        return CopyObjectOperation.class;
    }
}
