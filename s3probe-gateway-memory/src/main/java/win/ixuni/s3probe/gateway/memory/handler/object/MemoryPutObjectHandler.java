package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory PutObject handler
 */
public class MemoryPutObjectHandler extends AbstractMemoryHandler<PutObjectOperation, StoredObject> {

    @Override
    protected StoredObject doHandle(PutObjectOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        MemoryGatewayContext.validateKey(operation.getKey());
        byte[] data = operation.getContent() != null ? operation.getContent().clone() : new byte[0];

        var stored = context.store(bucket, MemoryGatewayContext.ObjectData.builder()
                .key(operation.getKey())
                .data(data)
                .etag(MemoryGatewayContext.quotedMd5(data))
                .contentType(operation.getContentType() != null
                        ? operation.getContentType() : "binary/octet-stream")
                .metadata(MemoryGatewayContext.normalizeMetadata(operation.getMetadata()))
                .contentEncoding(operation.getContentEncoding())
                .contentDisposition(operation.getContentDisposition())
                .contentLanguage(operation.getContentLanguage())
                .cacheControl(operation.getCacheControl())
                .expires(operation.getExpires()));

        return StoredObject.builder()
                .bucketName(bucket.getName())
                .key(stored.getKey())
                .etag(stored.getEtag())
                .versionId(bucket.isVersioningEnabled() ? stored.getVersionId() : null)
                .size((long) data.length)
                .build();
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
