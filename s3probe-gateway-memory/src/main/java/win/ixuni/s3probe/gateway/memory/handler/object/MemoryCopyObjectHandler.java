package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.object.CopyObjectOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.LinkedHashMap;

/**
 * Memory CopyObject handler
 */
public class MemoryCopyObjectHandler extends AbstractMemoryHandler<CopyObjectOperation, StoredObject> {

    @Override
    protected StoredObject doHandle(CopyObjectOperation operation, MemoryGatewayContext context) {
        var source = context.requireObject(operation.getSourceBucket(), operation.getSourceKey(), null);
        var target = context.requireBucket(operation.getDestinationBucket());
        MemoryGatewayContext.validateKey(operation.getDestinationKey());

        boolean replace = operation.getMetadataDirective() == CopyObjectOperation.MetadataDirective.REPLACE;
        var builder = source.toBuilder()
                .key(operation.getDestinationKey())
                .data(source.getData().clone())
                .deleteMarker(false)
                .tags(new LinkedHashMap<>(source.getTags()));
        if (replace) {
            builder.metadata(MemoryGatewayContext.normalizeMetadata(operation.getMetadata()))
                    .contentType(operation.getContentType() != null
                            ? operation.getContentType() : source.getContentType());
        }
        var stored = context.store(target, builder);

        return StoredObject.builder()
                .bucketName(target.getName())
                .key(stored.getKey())
                .etag(stored.getEtag())
                .versionId(target.isVersioningEnabled() ? stored.getVersionId() : null)
                .size((long) stored.getData().length)
                .build();
    }

    @Override
    public Class<CopyObjectOperation> getOperationType() {
        return CopyObjectOperation.class;
    }
}
