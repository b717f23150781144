package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.PutBucketTaggingRequest;
import win.ixuni.s3probe.core.operation.bucket.PutBucketTaggingOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;
import win.ixuni.s3probe.gateway.s3.handler.Tags;

public class S3PutBucketTaggingHandler extends AbstractS3Handler<PutBucketTaggingOperation, Void> {

    @Override
    protected Mono<Void> doHandle(PutBucketTaggingOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().putBucketTagging(
                        PutBucketTaggingRequest.builder()
                                .bucket(operation.getBucketName())
                                .tagging(Tags.toTagging(operation.getTags()))
                                .build()))
                .then();
    }

    @Override
    public Class<PutBucketTaggingOperation> getOperationType() {
        return PutBucketTaggingOperation.class;
    }
}
