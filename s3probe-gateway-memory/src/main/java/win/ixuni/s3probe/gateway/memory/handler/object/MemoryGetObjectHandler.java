package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.ObjectContent;
import win.ixuni.s3probe.core.operation.object.GetObjectOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.Arrays;

/**
 * Memory GetObject handler, including Range and If-Range
 */
public class MemoryGetObjectHandler extends AbstractMemoryHandler<GetObjectOperation, ObjectContent> {

    @Override
    protected ObjectContent doHandle(GetObjectOperation operation, MemoryGatewayContext context) {
        var object = context.requireObject(operation.getBucketName(), operation.getKey(), operation.getVersionId());
        byte[] data = object.getData();

        ByteRange range = rangeApplies(operation.getIfRange(), object.getEtag())
                ? ByteRange.resolve(operation.getRange(), data.length)
                : null;

        var metadata = MemoryHeadObjectHandler.toMetadata(operation.getBucketName(), object);
        if (range == null) {
            return ObjectContent.builder()
                    .statusCode(200)
                    .metadata(metadata)
                    .data(data.clone())
                    .build();
        }
        metadata.setContentLength((long) range.length());
        return ObjectContent.builder()
                .statusCode(206)
                .contentRange(range.contentRange())
                .metadata(metadata)
                .data(Arrays.copyOfRange(data, (int) range.start(), (int) range.end() + 1))
                .build();
    }

    /**
     * If-Range with a different ETag means the full object is sent
     */
    private static boolean rangeApplies(String ifRange, String etag) {
        if (ifRange == null) {
            return true;
        }
        return strip(ifRange).equals(strip(etag));
    }

    private static String strip(String etag) {
        return etag.replace("\"", "");
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
