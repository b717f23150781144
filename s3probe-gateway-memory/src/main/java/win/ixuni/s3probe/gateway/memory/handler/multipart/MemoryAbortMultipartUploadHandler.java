package win.ixuni.s3probe.gateway.memory.handler.multipart;

import win.ixuni.s3probe.core.operation.multipart.AbortMultipartUploadOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

/**
 * Memory abort multipart upload handler
 */
public class MemoryAbortMultipartUploadHandler extends AbstractMemoryHandler<AbortMultipartUploadOperation, Void> {

    @Override
    protected Void doHandle(AbortMultipartUploadOperation operation, MemoryGatewayContext context) {
        MultipartSupport.requireUpload(context, operation.getBucketName(), operation.getKey(), operation.getUploadId());
        context.getMultipartUploads().remove(operation.getUploadId());
        return null;
    }

    @Override
    public Class<AbortMultipartUploadOperation> getOperationType() {
        return AbortMultipartUploadOperation.class;
    }
}
