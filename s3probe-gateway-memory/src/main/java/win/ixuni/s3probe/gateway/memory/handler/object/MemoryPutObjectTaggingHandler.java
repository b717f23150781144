package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.operation.object.PutObjectTaggingOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory PutObjectTagging handler
 */
public class MemoryPutObjectTaggingHandler extends AbstractMemoryHandler<PutObjectTaggingOperation, Void> {

    private static final int MAX_OBJECT_TAGS = 10;

    @Override
    protected Void doHandle(PutObjectTaggingOperation operation, MemoryGatewayContext context) {
        var object = context.requireObject(operation.getBucketName(), operation.getKey(), null);
        MemoryGatewayContext.validateTags(operation.getTags(), MAX_OBJECT_TAGS);
        synchronized (object.getTags()) {
            object.getTags().clear();
            object.getTags().putAll(operation.getTags());
        }
        return null;
    }

    @Override
    public Class<PutObjectTaggingOperation> getOperationType() {
        return PutObjectTaggingOperation.class;
    }
}
