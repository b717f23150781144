package win.ixuni.s3probe.gateway.s3.handler.multipart;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.ListMultipartUploadsRequest;
import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.operation.multipart.ListMultipartUploadsOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.List;

/**
 * S3 list multipart uploads handler
 */
public class S3ListMultipartUploadsHandler
        extends AbstractS3Handler<ListMultipartUploadsOperation, List<MultipartUpload>> {

    @Override
    protected Mono<List<MultipartUpload>> doHandle(ListMultipartUploadsOperation operation, S3GatewayContext context) {
        var request = ListMultipartUploadsRequest.builder()
                .bucket(operation.getBucketName())
                .prefix(operation.getPrefix())
                .build();

        return Mono.fromFuture(() -> context.getS3Client().listMultipartUploads(request))
                .map(response -> response.uploads().stream()
                        .map(upload -> MultipartUpload.builder()
                                .bucketName(operation.getBucketName())
                                .key(upload.key())
                                .uploadId(upload.uploadId())
                                .initiated(upload.initiated())
                                .build())
                        .toList());
    }

    @Override
    public Class<ListMultipartUploadsOperation> getOperationType() {
        return ListMultipartUploadsOperation.class;
    }
}
