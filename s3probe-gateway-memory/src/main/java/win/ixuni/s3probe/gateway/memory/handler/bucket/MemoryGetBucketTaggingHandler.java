package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.bucket.GetBucketTaggingOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Memory GetBucketTagging handler. An untagged bucket answers NoSuchTagSet like S3 does.
 */
public class MemoryGetBucketTaggingHandler extends AbstractMemoryHandler<GetBucketTaggingOperation, Map<String, String>> {

    @Override
    protected Map<String, String> doHandle(GetBucketTaggingOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        synchronized (bucket) {
            if (bucket.getTags().isEmpty()) {
                throw new GatewayException("NoSuchTagSet", "The TagSet does not exist", 404);
            }
            return new LinkedHashMap<>(bucket.getTags());
        }
    }

    @Override
    public Class<GetBucketTaggingOperation> getOperationType() {
        return GetBucketTaggingOperation.class;
    }
}
