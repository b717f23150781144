package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.bucket.PutBucketVersioningOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory PutBucketVersioning handler
 */
public class MemoryPutBucketVersioningHandler extends AbstractMemoryHandler<PutBucketVersioningOperation, Void> {

    @Override
    protected Void doHandle(PutBucketVersioningOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        String status = operation.getStatus();
        if (!"Enabled".equals(status) && !"Suspended".equals(status)) {
            throw new GatewayException("IllegalVersioningConfigurationException",
                    "The versioning configuration specified in the request is invalid: " + status, 400);
        }
        bucket.setVersioningStatus(status);
        return null;
    }

    @Override
    public Class<PutBucketVersioningOperation> getOperationType() {
        return PutBucketVersioningOperation.class;
    }
}
