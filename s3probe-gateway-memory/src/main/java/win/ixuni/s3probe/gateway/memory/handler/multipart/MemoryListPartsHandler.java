package win.ixuni.s3probe.gateway.memory.handler.multipart;

import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.multipart.ListPartsOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Memory list parts handler
 */
public class MemoryListPartsHandler extends AbstractMemoryHandler<ListPartsOperation, List<UploadedPart>> {

    @Override
    protected List<UploadedPart> doHandle(ListPartsOperation operation, MemoryGatewayContext context) {
        var state = MultipartSupport.requireUpload(context,
                operation.getBucketName(), operation.getKey(), operation.getUploadId());

        return state.getParts().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
                .map(entry -> UploadedPart.builder()
                        .partNumber(entry.getKey())
                        .etag(entry.getValue().getEtag())
                        .size((long) entry.getValue().getData().length)
                        .lastModified(entry.getValue().getLastModified())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    public Class<ListPartsOperation> getOperationType() {
        return ListPartsOperation.class;
    }
}
