package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.operation.bucket.GetBucketVersioningOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory GetBucketVersioning handler. A bucket that never had versioning configured has no status.
 */
public class MemoryGetBucketVersioningHandler extends AbstractMemoryHandler<GetBucketVersioningOperation, String> {

    @Override
    protected String doHandle(GetBucketVersioningOperation operation, MemoryGatewayContext context) {
        return context.requireBucket(operation.getBucketName()).getVersioningStatus();
    }

    @Override
    public Class<GetBucketVersioningOperation> getOperationType() {
        return GetBucketVersioningOperation.class;
    }
}
