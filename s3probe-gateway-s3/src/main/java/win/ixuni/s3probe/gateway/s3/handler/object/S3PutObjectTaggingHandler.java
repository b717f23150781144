package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.PutObjectTaggingRequest;
import win.ixuni.s3probe.core.operation.object.PutObjectTaggingOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;
import win.ixuni.s3probe.gateway.s3.handler.Tags;

public class S3PutObjectTaggingHandler extends AbstractS3Handler<PutObjectTaggingOperation, Void> {

    @Override
    protected Mono<Void> doHandle(PutObjectTaggingOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().putObjectTagging(PutObjectTaggingRequest.builder()
                        .bucket(operation.getBucketName())
                        .key(operation.getKey())
                        .tagging(Tags.toTagging(operation.getTags()))
                        .build()))
                .then();
    }

    @Override
    public Class<PutObjectTaggingOperation> getOperationType() {
        return PutObjectTaggingOperation.class;
    }
}
