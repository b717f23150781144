package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.GetObjectTaggingRequest;
import win.ixuni.s3probe.core.operation.object.GetObjectTaggingOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;
import win.ixuni.s3probe.gateway.s3.handler.Tags;

import java.util.Map;

public class S3GetObjectTaggingHandler extends AbstractS3Handler<GetObjectTaggingOperation, Map<String, String>> {

    @Override
    protected Mono<Map<String, String>> doHandle(GetObjectTaggingOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().getObjectTagging(GetObjectTaggingRequest.builder()
                        .bucket(operation.getBucketName())
                        .key(operation.getKey())
                        .build()))
                .map(response -> Tags.toMap(response.tagSet()));
    }

    @Override
    public Class<GetObjectTaggingOperation> getOperationType() {
        return GetObjectTaggingOperation.class;
    }
}
