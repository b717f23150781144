package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningRequest;
import win.ixuni.s3probe.core.operation.bucket.GetBucketVersioningOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 get bucket versioning handler. Empty when versioning was never configured.
 */
public class S3GetBucketVersioningHandler extends AbstractS3Handler<GetBucketVersioningOperation, String> {

    @Override
    protected Mono<String> doHandle(GetBucketVersioningOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().getBucketVersioning(
                        GetBucketVersioningRequest.builder().bucket(operation.getBucketName()).build()))
                .flatMap(response -> Mono.justOrEmpty(response.statusAsString()));
    }

    @Override
    public Class<GetBucketVersioningOperation> getOperationType() {
        return GetBucketVersioningOperation.class;
    }
}
