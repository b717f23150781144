package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.operation.object.ListObjectsOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory ListObjects handler (V1)
 */
public class MemoryListObjectsHandler extends AbstractMemoryHandler<ListObjectsOperation, ListObjectsResult> {

    @Override
    protected ListObjectsResult doHandle(ListObjectsOperation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        return ObjectListing.list(bucket, operation.getPrefix(), operation.getDelimiter(),
                operation.getMarker(), operation.getMaxKeys());
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}
