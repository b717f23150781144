package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.ObjectVersion;
import win.ixuni.s3probe.core.operation.object.ListObjectVersionsOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Memory ListObjectVersions handler: keys ascending, newest version first within a key
 */
public class MemoryListObjectVersionsHandler
        extends AbstractMemoryHandler<ListObjectVersionsOperation, List<ObjectVersion>> {

    @Override
    protected List<ObjectVersion> doHandle(ListObjectVersionsOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        String prefix = operation.getPrefix() != null ? operation.getPrefix() : "";

        List<ObjectVersion> result = new ArrayList<>();
        synchronized (bucket) {
            for (Map.Entry<String, List<MemoryGatewayContext.ObjectData>> entry : bucket.getObjects().entrySet()) {
                if (!entry.getKey().startsWith(prefix)) {
                    continue;
                }
                List<MemoryGatewayContext.ObjectData> versions = entry.getValue();
                for (int i = versions.size() - 1; i >= 0; i--) {
                    var version = versions.get(i);
                    result.add(ObjectVersion.builder()
                            .key(entry.getKey())
                            .versionId(version.getVersionId())
                            .latest(i == versions.size() - 1)
                            .deleteMarker(version.isDeleteMarker())
                            .size(version.isDeleteMarker() ? null : (long) version.getData().length)
                            .etag(version.getEtag())
                            .lastModified(version.getLastModified())
                            .build());
                }
            }
        }
        return result;
    }

    @Override
    public Class<ListObjectVersionsOperation> getOperationType() {
        return ListObjectVersionsOperation.class;
    }
}
