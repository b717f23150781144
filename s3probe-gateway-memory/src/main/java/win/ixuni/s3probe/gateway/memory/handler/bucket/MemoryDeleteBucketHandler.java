package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory DeleteBucket handler. Versions and delete markers keep a bucket non-empty.
 */
public class MemoryDeleteBucketHandler extends AbstractMemoryHandler<DeleteBucketOperation, Void> {

    @Override
    protected Void doHandle(DeleteBucketOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        synchronized (bucket) {
            if (!bucket.isEmpty()) {
                throw new GatewayException("BucketNotEmpty",
                        "The bucket you tried to delete is not empty: " + bucket.getName(), 409);
            }
            context.getBuckets().remove(bucket.getName());
        }
        context.getMultipartUploads().values()
                .removeIf(upload -> upload.getBucketName().equals(bucket.getName()));
        return null;
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }
}
