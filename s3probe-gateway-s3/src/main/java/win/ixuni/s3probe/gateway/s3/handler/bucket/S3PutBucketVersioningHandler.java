package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.PutBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.VersioningConfiguration;
import win.ixuni.s3probe.core.operation.bucket.PutBucketVersioningOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

public class S3PutBucketVersioningHandler extends AbstractS3Handler<PutBucketVersioningOperation, Void> {

    @Override
    protected Mono<Void> doHandle(PutBucketVersioningOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().putBucketVersioning(
                        PutBucketVersioningRequest.builder()
                                .bucket(operation.getBucketName())
                                .versioningConfiguration(VersioningConfiguration.builder()
                                        .status(operation.getStatus())
                                        .build())
                                .build()))
                .then();
    }

    @Override
    public Class<PutBucketVersioningOperation> getOperationType() {
        return PutBucketVersioningOperation.class;
    }
}
