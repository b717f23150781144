package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import win.ixuni.s3probe.core.operation.object.DeleteObjectOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 delete object handler
 */
public class S3DeleteObjectHandler extends AbstractS3Handler<DeleteObjectOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteObjectOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().deleteObject(DeleteObjectRequest.builder()
                        .bucket(operation.getBucketName())
                        .key(operation.getKey())
                        .versionId(operation.getVersionId())
                        .build()))
                .then();
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
