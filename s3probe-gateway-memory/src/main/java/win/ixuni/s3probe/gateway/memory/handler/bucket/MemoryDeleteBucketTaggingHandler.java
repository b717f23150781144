package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.operation.bucket.DeleteBucketTaggingOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory DeleteBucketTagging handler
 */
public class MemoryDeleteBucketTaggingHandler extends AbstractMemoryHandler<DeleteBucketTaggingOperation, Void> {

    @Override
    protected Void doHandle(DeleteBucketTaggingOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        synchronized (bucket) {
            bucket.getTags().clear();
        }
        return null;
    }

    @Override
    public Class<DeleteBucketTaggingOperation> getOperationType() {
        return DeleteBucketTaggingOperation.class;
    }
}
