package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import win.ixuni.s3probe.core.operation.bucket.HeadBucketOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 head bucket handler
 */
public class S3HeadBucketHandler extends AbstractS3Handler<HeadBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(HeadBucketOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().headBucket(
                HeadBucketRequest.builder().bucket(operation.getBucketName()).build()))
                .then();
    }

    @Override
    public Class<HeadBucketOperation> getOperationType() {
        return HeadBucketOperation.class;
    }
}
