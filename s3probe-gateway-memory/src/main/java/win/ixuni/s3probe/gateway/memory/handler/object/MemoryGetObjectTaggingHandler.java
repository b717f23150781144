package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.operation.object.GetObjectTaggingOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Memory GetObjectTagging handler. An untagged object has an empty tag set.
 */
public class MemoryGetObjectTaggingHandler extends AbstractMemoryHandler<GetObjectTaggingOperation, Map<String, String>> {

    @Override
    protected Map<String, String> doHandle(GetObjectTaggingOperation operation, MemoryGatewayContext context) {
        var object = context.requireObject(operation.getBucketName(), operation.getKey(), null);
        synchronized (object.getTags()) {
            return new LinkedHashMap<>(object.getTags());
        }
    }

    @Override
    public Class<GetObjectTaggingOperation> getOperationType() {
        return GetObjectTaggingOperation.class;
    }
}
