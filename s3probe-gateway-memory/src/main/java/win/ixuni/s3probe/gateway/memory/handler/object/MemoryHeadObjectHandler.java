package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.operation.object.HeadObjectOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory HeadObject handler
 */
public class MemoryHeadObjectHandler extends AbstractMemoryHandler<HeadObjectOperation, ObjectMetadata> {

    @Override
    protected ObjectMetadata doHandle(HeadObjectOperation operation, MemoryGatewayContext context) {
        var object = context.requireObject(operation.getBucketName(), operation.getKey(), operation.getVersionId());
        return toMetadata(operation.getBucketName(), object);
    }

    static ObjectMetadata toMetadata(String bucketName, MemoryGatewayContext.ObjectData object) {
        return ObjectMetadata.builder()
                .bucketName(bucketName)
                .key(object.getKey())
                .contentLength((long) object.getData().length)
                .etag(object.getEtag())
                .contentType(object.getContentType())
                .lastModified(object.getLastModified())
                .versionId("null".equals(object.getVersionId()) ? null : object.getVersionId())
                .storageClass("STANDARD")
                .userMetadata(object.getMetadata())
                .contentEncoding(object.getContentEncoding())
                .contentDisposition(object.getContentDisposition())
                .contentLanguage(object.getContentLanguage())
                .cacheControl(object.getCacheControl())
                .expires(object.getExpires())
                .build();
    }

    @Override
    public Class<HeadObjectOperation> getOperationType() {
        return HeadObjectOperation.class;
    }
}
