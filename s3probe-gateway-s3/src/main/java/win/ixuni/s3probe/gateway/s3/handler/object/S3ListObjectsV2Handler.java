package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.model.ObjectSummary;
import win.ixuni.s3probe.core.operation.object.ListObjectsV2Operation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.List;

/**
 * S3 list objects V2 handler
 */
public class S3ListObjectsV2Handler extends AbstractS3Handler<ListObjectsV2Operation, ListObjectsResult> {

    @Override
    protected Mono<ListObjectsResult> doHandle(ListObjectsV2Operation operation, S3GatewayContext context) {
        var request = ListObjectsV2Request.builder()
                .bucket(operation.getBucketName())
                .prefix(operation.getPrefix())
                .continuationToken(operation.getContinuationToken())
                .delimiter(operation.getDelimiter())
                .maxKeys(operation.getMaxKeys())
                .build();

        return Mono.fromFuture(() -> context.getS3Client().listObjectsV2(request))
                .map(response -> {
                    List<ObjectSummary> objects = response.contents().stream()
                            .map(S3ListObjectsHandler::toSummary)
                            .toList();
                    List<String> prefixes = response.commonPrefixes().stream()
                            .map(CommonPrefix::prefix)
                            .toList();
                    return ListObjectsResult.builder()
                            .bucketName(operation.getBucketName())
                            .prefix(operation.getPrefix())
                            .objects(objects)
                            .commonPrefixes(prefixes)
                            .truncated(Boolean.TRUE.equals(response.isTruncated()))
                            .nextToken(response.nextContinuationToken())
                            .keyCount(response.keyCount())
                            .build();
                });
    }

    @Override
    public Class<ListObjectsV2Operation> getOperationType() {
        return ListObjectsV2Operation.class;
    }
}
