package win.ixuni.s3probe.gateway.memory.handler.bucket;

import win.ixuni.s3probe.core.model.BucketInfo;
import win.ixuni.s3probe.core.operation.bucket.ListBucketsOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.Comparator;
import java.util.List;

/**
 * Memory ListBuckets handler
 */
public class MemoryListBucketsHandler extends AbstractMemoryHandler<ListBucketsOperation, List<BucketInfo>> {

    @Override
    protected List<BucketInfo> doHandle(ListBucketsOperation operation, MemoryGatewayContext context) {
        return context.getBuckets().values().stream()
                .map(bucket -> BucketInfo.builder()
                        .name(bucket.getName())
                        .creationDate(bucket.getCreationDate())
                        .build())
                .sorted(Comparator.comparing(BucketInfo::getName))
                .toList();
    }

    @Override
    public Class<ListBucketsOperation> getOperationType() {
        return ListBucketsOperation.class;
    }
}
