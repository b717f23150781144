package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.model.ObjectSummary;
import win.ixuni.s3probe.core.operation.object.ListObjectsOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.List;

/**
 * S3 list objects handler (V1)
 */
public class S3ListObjectsHandler extends AbstractS3Handler<ListObjectsOperation, ListObjectsResult> {

    @Override
    protected Mono<ListObjectsResult> doHandle(ListObjectsOperation operation, S3GatewayContext context) {
        var request = ListObjectsRequest.builder()
                .bucket(operation.getBucketName())
                .prefix(operation.getPrefix())
                .marker(operation.getMarker())
                .delimiter(operation.getDelimiter())
                .maxKeys(operation.getMaxKeys())
                .build();

        return Mono.fromFuture(() -> context.getS3Client().listObjects(request))
                .map(response -> {
                    List<ObjectSummary> objects = response.contents().stream()
                            .map(S3ListObjectsHandler::toSummary)
                            .toList();
                    List<String> prefixes = response.commonPrefixes().stream()
                            .map(CommonPrefix::prefix)
                            .toList();
                    boolean truncated = Boolean.TRUE.equals(response.isTruncated());
                    // NextMarker is only returned with a delimiter; otherwise the last key is the marker
                    String next = response.nextMarker();
                    if (truncated && next == null && !objects.isEmpty()) {
                        next = objects.get(objects.size() - 1).getKey();
                    }
                    return ListObjectsResult.builder()
                            .bucketName(operation.getBucketName())
                            .prefix(operation.getPrefix())
                            .objects(objects)
                            .commonPrefixes(prefixes)
                            .truncated(truncated)
                            .nextToken(truncated ? next : null)
                            .keyCount(objects.size() + prefixes.size())
                            .build();
                });
    }

    static ObjectSummary toSummary(S3Object object) {
        return ObjectSummary.builder()
                .key(object.key())
                .size(object.size())
                .etag(object.eTag())
                .lastModified(object.lastModified())
                .storageClass(object.storageClassAsString())
                .build();
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
