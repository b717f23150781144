package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.time.Instant;

/**
 * Memory CreateBucket handler
 */
public class MemoryCreateBucketHandler extends AbstractMemoryHandler<CreateBucketOperation, Void> {

    @Override
    protected Void doHandle(CreateBucketOperation operation, MemoryGatewayContext context) {
        String bucketName = operation.getBucketName();
        MemoryGatewayContext.validateBucketName(bucketName);

        var bucket = new MemoryGatewayContext.BucketState(bucketName, Instant.now());
        if (context.getBuckets().putIfAbsent(bucketName, bucket) != null) {
            throw new GatewayException("BucketAlreadyOwnedByYou",
                    "Your previous request to create the named bucket succeeded and you already own it", 409);
        }
        return null;
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}
