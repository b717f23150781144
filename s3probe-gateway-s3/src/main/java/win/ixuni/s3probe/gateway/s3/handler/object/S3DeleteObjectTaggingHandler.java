package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteObjectTaggingRequest;
import win.ixuni.s3probe.core.operation.object.DeleteObjectTaggingOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

public class S3DeleteObjectTaggingHandler extends AbstractS3Handler<DeleteObjectTaggingOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteObjectTaggingOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().deleteObjectTagging(DeleteObjectTaggingRequest.builder()
                        .bucket(operation.getBucketName())
                        .key(operation.getKey())
                        .build()))
                .then();
    }

    @Override
    public Class<DeleteObjectTaggingOperation> getOperationType() {
        return DeleteObjectTaggingOperation.class;
    }
}
