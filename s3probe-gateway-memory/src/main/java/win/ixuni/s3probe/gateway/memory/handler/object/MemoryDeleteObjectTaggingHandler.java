package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.operation.object.DeleteObjectTaggingOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory DeleteObjectTagging handler
 */
public class MemoryDeleteObjectTaggingHandler extends AbstractMemoryHandler<DeleteObjectTaggingOperation, Void> {

    @Override
    protected Void doHandle(DeleteObjectTaggingOperation operation, MemoryGatewayContext context) {
        var object = context.requireObject(operation.getBucketName(), operation.getKey(), null);
        synchronized (object.getTags()) {
            object.getTags().clear();
        }
        return null;
    }

    @Override
    public Class<DeleteObjectTaggingOperation> getOperationType() {
        return DeleteObjectTaggingOperation.class;
    }
}
