package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 create bucket handler
 * <p>
 * Outside us-east-1 the region goes into the location constraint, as AWS requires.
 */
public class S3CreateBucketHandler extends AbstractS3Handler<CreateBucketOperation, Void> {

    private static final String DEFAULT_REGION = "us-east-1";

    private final String region;

    public S3CreateBucketHandler(String region) {
        this.region = region;
    }

    @Override
    protected Mono<Void> doHandle(CreateBucketOperation operation, S3GatewayContext context) {
        var request = CreateBucketRequest.builder().bucket(operation.getBucketName());
        if (region != null && !region.isBlank() && !DEFAULT_REGION.equals(region)) {
            request.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region)
                    .build());
        }
        return Mono.fromFuture(() -> context.getS3Client().createBucket(request.build()))
                .then();
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}
