package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.operation.object.ListObjectsV2Operation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Memory ListObjectsV2 handler. Continuation tokens are the base64 encoded last key of the page.
 */
public class MemoryListObjectsV2Handler extends AbstractMemoryHandler<ListObjectsV2Operation, ListObjectsResult> {

    @Override
    protected ListObjectsResult doHandle(ListObjectsV2Operation operation, MemoryGatewayContext context) {
        var bucket = context.requireBucket(operation.getBucketName());
        String startAfter = decode(operation.getContinuationToken());

        ListObjectsResult result = ObjectListing.list(bucket, operation.getPrefix(), operation.getDelimiter(),
                startAfter, operation.getMaxKeys());
        if (result.getNextToken() != null) {
            result.setNextToken(Base64.getUrlEncoder().encodeToString(
                    result.getNextToken().getBytes(StandardCharsets.UTF_8)));
        }
        return result;
    }

    private static String decode(String token) {
        if (token == null) {
            return null;
        }
        try {
            return new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw GatewayException.invalidArgument("The continuation token provided is incorrect");
        }
    }

    @Override
    public Class<ListObjectsV2Operation> getOperationType() {
        return ListObjectsV2Operation.class;
    }
}
