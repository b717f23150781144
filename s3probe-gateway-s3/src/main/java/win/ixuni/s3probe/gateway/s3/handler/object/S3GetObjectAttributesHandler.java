package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.GetObjectAttributesRequest;
import software.amazon.awssdk.services.s3.model.GetObjectAttributesResponse;
import win.ixuni.s3probe.core.model.ObjectAttribute;
import win.ixuni.s3probe.core.model.ObjectAttributes;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.object.GetObjectAttributesOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.List;

/**
 * S3 get object attributes handler
 */
public class S3GetObjectAttributesHandler extends AbstractS3Handler<GetObjectAttributesOperation, ObjectAttributes> {

    @Override
    protected Mono<ObjectAttributes> doHandle(GetObjectAttributesOperation operation, S3GatewayContext context) {
        var request = GetObjectAttributesRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .objectAttributes(operation.getAttributes().stream()
                        .map(S3GetObjectAttributesHandler::toSdkAttribute)
                        .toList())
                .build();
        return Mono.fromFuture(() -> context.getS3Client().getObjectAttributes(request))
                .map(S3GetObjectAttributesHandler::toAttributes);
    }

    /**
     * Wire names of the requested attributes
     */
    private static software.amazon.awssdk.services.s3.model.ObjectAttributes toSdkAttribute(ObjectAttribute attribute) {
        String wireName = switch (attribute) {
            case ETAG -> "ETag";
            case OBJECT_SIZE -> "ObjectSize";
            case STORAGE_CLASS -> "StorageClass";
            case OBJECT_PARTS -> "ObjectParts";
            case CHECKSUM -> "Checksum";
        };
        return software.amazon.awssdk.services.s3.model.ObjectAttributes.fromValue(wireName);
    }

    private static ObjectAttributes toAttributes(GetObjectAttributesResponse response) {
        var builder = ObjectAttributes.builder()
                .etag(response.eTag())
                .objectSize(response.objectSize())
                .storageClass(response.storageClassAsString());
        if (response.objectParts() != null) {
            List<UploadedPart> parts = response.objectParts().parts().stream()
                    .map(part -> UploadedPart.builder()
                            .partNumber(part.partNumber())
                            .size(part.size())
                            .build())
                    .toList();
            builder.totalPartsCount(response.objectParts().totalPartsCount())
                    .parts(parts);
        }
        return builder.build();
    }

    @Override
    public Class<GetObjectAttributesOperation> getOperationType() {
        return GetObjectAttributesOperation.class;
    }
}
