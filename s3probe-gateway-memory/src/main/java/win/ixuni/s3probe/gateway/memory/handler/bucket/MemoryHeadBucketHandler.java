package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.operation.bucket.HeadBucketOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory HeadBucket handler
 */
public class MemoryHeadBucketHandler extends AbstractMemoryHandler<HeadBucketOperation, Void> {

    @Override
    protected Void doHandle(HeadBucketOperation operation, MemoryGatewayContext context) {
        context.requireBucket(operation.getBucketName());
        return null;
    }

    @Override
    public Class<HeadBucketOperation> getOperationType() {
        return HeadBucketOperation.class;
    }
}
