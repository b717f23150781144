package win.ixuni.s3probe.gateway.memory.handler.multipart;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.multipart.UploadPartOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.time.Instant;

/**
 * Memory upload part handler. Re-uploading a part number replaces the earlier part.
 */
public class MemoryUploadPartHandler extends AbstractMemoryHandler<UploadPartOperation, UploadedPart> {

    private static final int MAX_PART_NUMBER = 10000;

    @Override
    protected UploadedPart doHandle(UploadPartOperation operation, MemoryGatewayContext context) {
        if (operation.getPartNumber() < 1 || operation.getPartNumber() > MAX_PART_NUMBER) {
            throw GatewayException.invalidArgument(
                    "Part number must be an integer between 1 and " + MAX_PART_NUMBER + ", inclusive");
        }
        var state = MultipartSupport.requireUpload(context,
                operation.getBucketName(), operation.getKey(), operation.getUploadId());

        byte[] data = operation.getContent() != null ? operation.getContent() : new byte[0];
        String etag = MemoryGatewayContext.quotedMd5(data);
        Instant now = Instant.now();
        state.getParts().put(operation.getPartNumber(), MemoryGatewayContext.PartData.builder()
                .data(data)
                .etag(etag)
                .lastModified(now)
                .build());

        return UploadedPart.builder()
                .partNumber(operation.getPartNumber())
                .etag(etag)
                .size((long) data.length)
                .lastModified(now)
                .build();
    }

    @Override
    public Class<UploadPartOperation> getOperationType() {
        return UploadPartOperation.class;
    }
}
