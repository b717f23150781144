package win.ixuni.s3probe.gateway.memory.handler.multipart;

import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.operation.multipart.ListMultipartUploadsOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Memory list multipart uploads handler
 */
public class MemoryListMultipartUploadsHandler
        extends AbstractMemoryHandler<ListMultipartUploadsOperation, List<MultipartUpload>> {

    @Override
    protected List<MultipartUpload> doHandle(ListMultipartUploadsOperation operation, MemoryGatewayContext context) {
        String bucketName = operation.getBucketName();
        context.requireBucket(bucketName);
        String prefix = operation.getPrefix() != null ? operation.getPrefix() : "";

        return context.getMultipartUploads().values().stream()
                .filter(state -> state.getBucketName().equals(bucketName))
                .filter(state -> state.getKey().startsWith(prefix))
                .sorted(Comparator.comparing(MemoryGatewayContext.MultipartState::getKey)
                        .thenComparing(MemoryGatewayContext.MultipartState::getInitiated))
                .map(state -> MultipartUpload.builder()
                        .bucketName(bucketName)
                        .key(state.getKey())
                        .uploadId(state.getUploadId())
                        .initiated(state.getInitiated())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    public Class<ListMultipartUploadsOperation> getOperationType() {
        return ListMultipartUploadsOperation.class;
    }
}
