package win.ixuni.s3probe.gateway.s3.handler.multipart;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.ListPartsRequest;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.multipart.ListPartsOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.List;

/**
 * S3 list parts handler
 */
public class S3ListPartsHandler extends AbstractS3Handler<ListPartsOperation, List<UploadedPart>> {

    @Override
    protected Mono<List<UploadedPart>> doHandle(ListPartsOperation operation, S3GatewayContext context) {
        var request = ListPartsRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .uploadId(operation.getUploadId())
                .build();

        return Mono.fromFuture(() -> context.getS3Client().listParts(request))
                .map(response -> response.parts().stream()
                        .map(part -> UploadedPart.builder()
                                .partNumber(part.partNumber())
                                .etag(part.eTag())
                                .size(part.size())
                                .lastModified(part.lastModified())
                                .build())
                        .toList());
    }

    @Override
    public Class<ListPartsOperation> getOperationType() {
        return ListPartsOperation.class;
    }
}
