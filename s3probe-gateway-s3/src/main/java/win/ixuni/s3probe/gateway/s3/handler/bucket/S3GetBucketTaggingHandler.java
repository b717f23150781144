package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingRequest;
import win.ixuni.s3probe.core.operation.bucket.GetBucketTaggingOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;
import win.ixuni.s3probe.gateway.s3.handler.Tags;

import java.util.Map;

/**
 * S3 get bucket tagging handler
 */
public class S3GetBucketTaggingHandler extends AbstractS3Handler<GetBucketTaggingOperation, Map<String, String>> {

    @Override
    protected Mono<Map<String, String>> doHandle(GetBucketTaggingOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().getBucketTagging(
                        GetBucketTaggingRequest.builder().bucket(operation.getBucketName()).build()))
                .map(response -> Tags.toMap(response.tagSet()));
    }

    @Override
    public Class<GetBucketTaggingOperation> getOperationType() {
        return GetBucketTaggingOperation.class;
    }
}
