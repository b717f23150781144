package win.ixuni.s3probe.gateway.memory.handler.multipart;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;

final class MultipartSupport {

    private MultipartSupport() {
    }

    /**
     * @throws GatewayException NoSuchUpload when the id is unknown or belongs to another bucket/key
     */
    static MemoryGatewayContext.MultipartState requireUpload(MemoryGatewayContext context,
                                                             String bucketName, String key, String uploadId) {
        context.requireBucket(bucketName);
        MemoryGatewayContext.MultipartState state = uploadId != null
                ? context.getMultipartUploads().get(uploadId)
                : null;
        if (state == null || !state.getBucketName().equals(bucketName) || !state.getKey().equals(key)) {
            throw GatewayException.noSuchUpload(uploadId);
        }
        return state;
    }
}
