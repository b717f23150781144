package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsRequest;
import software.amazon.awssdk.services.s3.model.ListObjectVersionsResponse;
import win.ixuni.s3probe.core.model.ObjectVersion;
import win.ixuni.s3probe.core.operation.object.ListObjectVersionsOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * S3 list object versions handler
 * <p>
 * Versions and delete markers arrive as two lists; they are merged back into key order.
 */
public class S3ListObjectVersionsHandler
        extends AbstractS3Handler<ListObjectVersionsOperation, List<ObjectVersion>> {

    @Override
    protected Mono<List<ObjectVersion>> doHandle(ListObjectVersionsOperation operation, S3GatewayContext context) {
        var request = ListObjectVersionsRequest.builder()
                .bucket(operation.getBucketName())
                .prefix(operation.getPrefix())
                .build();
        return Mono.fromFuture(() -> context.getS3Client().listObjectVersions(request))
                .map(S3ListObjectVersionsHandler::toVersions);
    }

    private static List<ObjectVersion> toVersions(ListObjectVersionsResponse response) {
        List<ObjectVersion> versions = new ArrayList<>();
        response.versions().forEach(version -> versions.add(ObjectVersion.builder()
                .key(version.key())
                .versionId(version.versionId())
                .latest(Boolean.TRUE.equals(version.isLatest()))
                .size(version.size())
                .etag(version.eTag())
                .lastModified(version.lastModified())
                .build()));
        response.deleteMarkers().forEach(marker -> versions.add(ObjectVersion.builder()
                .key(marker.key())
                .versionId(marker.versionId())
                .latest(Boolean.TRUE.equals(marker.isLatest()))
                .deleteMarker(true)
                .lastModified(marker.lastModified())
                .build()));
        // Stable sort: within a key the backend order (newest first) is kept
        versions.sort(Comparator.comparing(ObjectVersion::getKey));
        return versions;
    }

    @Override
    public Class<ListObjectVersionsOperation> getOperationType() {
        return ListObjectVersionsOperation.class;
    }
}
