package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.bucket.GetBucketPolicyOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory GetBucketPolicy handler. Policies are not stored, so every bucket answers NoSuchBucketPolicy.
 */
public class MemoryGetBucketPolicyHandler extends AbstractMemoryHandler<GetBucketPolicyOperation, String> {

    @Override
    protected String doHandle(GetBucketPolicyOperation operation, MemoryGatewayContext context) {
        context.requireBucket(operation.getBucketName());
        throw new GatewayException("NoSuchBucketPolicy", "The bucket policy does not exist", 404);
    }

    @Override
    public Class<GetBucketPolicyOperation> getOperationType() {
        return GetBucketPolicyOperation.class;
    }
}
