package win.ixuni.s3probe.gateway.memory.handler.multipart;

import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.multipart.CompleteMultipartUploadOperation;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.AbstractMemoryHandler;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Memory complete multipart upload handler
 * <p>
 * Validates the part list the way S3 does, then stores the concatenated object. The ETag is the MD5
 * of the concatenated binary part digests followed by "-" and the part count.
 */
public class MemoryCompleteMultipartUploadHandler
        extends AbstractMemoryHandler<CompleteMultipartUploadOperation, StoredObject> {

    @Override
    protected StoredObject doHandle(CompleteMultipartUploadOperation operation, MemoryGatewayContext context) {
        var state = MultipartSupport.requireUpload(context,
                operation.getBucketName(), operation.getKey(), operation.getUploadId());
        List<UploadedPart> requested = operation.getParts();
        if (requested == null || requested.isEmpty()) {
            throw new GatewayException("MalformedXML",
                    "The XML you provided was not well-formed or did not validate against our published schema", 400);
        }

        List<MemoryGatewayContext.PartData> selected = new ArrayList<>();
        int previous = 0;
        for (UploadedPart part : requested) {
            if (part.getPartNumber() <= previous) {
                throw new GatewayException("InvalidPartOrder",
                        "The list of parts was not in ascending order", 400);
            }
            previous = part.getPartNumber();
            var stored = state.getParts().get(part.getPartNumber());
            if (stored == null || !sameEtag(stored.getEtag(), part.getEtag())) {
                throw new GatewayException("InvalidPart",
                        "One or more of the specified parts could not be found: " + part.getPartNumber(), 400);
            }
            selected.add(stored);
        }

        for (int i = 0; i < selected.size() - 1; i++) {
            if (selected.get(i).getData().length < MemoryGatewayContext.MIN_PART_SIZE) {
                throw new GatewayException("EntityTooSmall",
                        "Your proposed upload is smaller than the minimum allowed size", 400);
            }
        }

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        ByteArrayOutputStream digests = new ByteArrayOutputStream();
        List<UploadedPart> parts = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            var part = selected.get(i);
            content.writeBytes(part.getData());
            digests.writeBytes(HexFormat.of().parseHex(part.getEtag().replace("\"", "")));
            parts.add(UploadedPart.builder()
                    .partNumber(requested.get(i).getPartNumber())
                    .etag(part.getEtag())
                    .size((long) part.getData().length)
                    .lastModified(part.getLastModified())
                    .build());
        }
        byte[] data = content.toByteArray();
        String etag = "\"" + MemoryGatewayContext.md5Hex(digests.toByteArray()) + "-" + selected.size() + "\"";

        var bucket = context.requireBucket(operation.getBucketName());
        var object = context.store(bucket, MemoryGatewayContext.ObjectData.builder()
                .key(operation.getKey())
                .data(data)
                .etag(etag)
                .contentType(state.getContentType() != null ? state.getContentType() : "binary/octet-stream")
                .metadata(state.getMetadata())
                .parts(List.copyOf(parts)));

        context.getMultipartUploads().remove(operation.getUploadId());

        return StoredObject.builder()
                .bucketName(operation.getBucketName())
                .key(operation.getKey())
                .etag(etag)
                .versionId(bucket.isVersioningEnabled() ? object.getVersionId() : null)
                .size((long) data.length)
                .build();
    }

    private static boolean sameEtag(String stored, String given) {
        return given != null && stored.replace("\"", "").equals(given.replace("\"", ""));
    }

    @Override
    public Class<CompleteMultipartUploadOperation> getOperationType() {
        return CompleteMultipartUploadOperation.class;
    }
}
