package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 delete bucket handler
 */
public class S3DeleteBucketHandler extends AbstractS3Handler<DeleteBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().deleteBucket(
                DeleteBucketRequest.builder().bucket(operation.getBucketName()).build()))
                .then();
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }
}
