package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.ObjectAttribute;
import win.ixuni.s3probe.core.model.ObjectAttributes;
import win.ixuni.s3probe.core.operation.object.GetObjectAttributesOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.Set;

/**
 * Memory GetObjectAttributes handler. Like S3, the ETag comes back without quotes and parts are
 * only reported for objects assembled from a multipart upload.
 */
public class MemoryGetObjectAttributesHandler
        extends AbstractMemoryHandler<GetObjectAttributesOperation, ObjectAttributes> {

    @Override
    protected ObjectAttributes doHandle(GetObjectAttributesOperation operation, MemoryGatewayContext context) {
        var object = context.requireObject(operation.getBucketName(), operation.getKey(), null);
        Set<ObjectAttribute> requested = operation.getAttributes() != null ? operation.getAttributes() : Set.of();

        var builder = ObjectAttributes.builder();
        if (requested.contains(ObjectAttribute.ETAG)) {
            builder.etag(object.getEtag().replace("\"", ""));
        }
        if (requested.contains(ObjectAttribute.OBJECT_SIZE)) {
            builder.objectSize((long) object.getData().length);
        }
        if (requested.contains(ObjectAttribute.STORAGE_CLASS)) {
            builder.storageClass("STANDARD");
        }
        if (requested.contains(ObjectAttribute.OBJECT_PARTS) && object.getParts() != null) {
            builder.totalPartsCount(object.getParts().size())
                    .parts(object.getParts());
        }
        return builder.build();
    }

    @Override
    public Class<GetObjectAttributesOperation> getOperationType() {
        return GetObjectAttributesOperation.class;
    }
}
