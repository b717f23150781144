package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.operation.object.DeleteObjectOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.List;

/**
 * Memory DeleteObject handler
 * <p>
 * Deleting a missing key succeeds. On a versioned bucket a delete without version id adds a delete
 * marker; with a version id that version is removed for good.
 */
public class MemoryDeleteObjectHandler extends AbstractMemoryHandler<DeleteObjectOperation, Void> {

    @Override
    protected Void doHandle(DeleteObjectOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        String key = operation.getKey();
        String versionId = operation.getVersionId();

        if (versionId != null) {
            synchronized (bucket) {
                List<MemoryGatewayContext.ObjectData> versions = bucket.getObjects().get(key);
                if (versions != null) {
                    versions.removeIf(v -> versionId.equals(v.getVersionId()));
                    if (versions.isEmpty()) {
                        bucket.getObjects().remove(key);
                    }
                }
            }
            return null;
        }

        if (bucket.isVersioningEnabled()) {
            if (bucket.getObjects().containsKey(key)) {
                context.store(bucket, MemoryGatewayContext.ObjectData.builder()
                        .key(key)
                        .data(new byte[0])
                        .deleteMarker(true));
            }
            return null;
        }

        synchronized (bucket) {
            bucket.getObjects().remove(key);
        }
        return null;
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
