package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.GetBucketPolicyRequest;
import win.ixuni.s3probe.core.operation.bucket.GetBucketPolicyOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 get bucket policy handler
 */
public class S3GetBucketPolicyHandler extends AbstractS3Handler<GetBucketPolicyOperation, String> {

    @Override
    protected Mono<String> doHandle(GetBucketPolicyOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().getBucketPolicy(
                        GetBucketPolicyRequest.builder().bucket(operation.getBucketName()).build()))
                .flatMap(response -> Mono.justOrEmpty(response.policy()));
    }

    @Override
    public Class<GetBucketPolicyOperation> getOperationType() {
        return GetBucketPolicyOperation.class;
    }
}
