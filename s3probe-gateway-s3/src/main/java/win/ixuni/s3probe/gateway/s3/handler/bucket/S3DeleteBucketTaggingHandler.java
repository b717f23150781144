package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteBucketTaggingRequest;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketTaggingOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

public class S3DeleteBucketTaggingHandler extends AbstractS3Handler<DeleteBucketTaggingOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketTaggingOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().deleteBucketTagging(
                        DeleteBucketTaggingRequest.builder().bucket(operation.getBucketName()).build()))
                .then();
    }

    @Override
    public Class<DeleteBucketTaggingOperation> getOperationType() {
        return DeleteBucketTaggingOperation.class;
    }
}
