package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.operation.bucket.PutBucketTaggingOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory PutBucketTagging handler
 */
public class MemoryPutBucketTaggingHandler extends AbstractMemoryHandler<PutBucketTaggingOperation, Void> {

    private static final int MAX_BUCKET_TAGS = 50;

    @Override
    protected Void doHandle(PutBucketTaggingOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        MemoryGatewayContext.validateTags(operation.getTags(), MAX_BUCKET_TAGS);
        synchronized (bucket) {
            bucket.getTags().clear();
            bucket.getTags().putAll(operation.getTags());
        }
        return null;
    }

    @Override
    public Class<PutBucketTaggingOperation> getOperationType() {
        return PutBucketTaggingOperation.class;
    }
}
