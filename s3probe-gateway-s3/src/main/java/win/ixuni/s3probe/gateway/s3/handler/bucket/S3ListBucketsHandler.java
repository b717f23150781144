package win.ixuni.s3probe.gateway.s3.handler.bucket;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import win.ixuni.s3probe.core.model.BucketInfo;
import win.ixuni.s3probe.core.operation.bucket.ListBucketsOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

import java.util.List;

/**
 * S3 list buckets handler
 */
public class S3ListBucketsHandler extends AbstractS3Handler<ListBucketsOperation, List<BucketInfo>> {

    @Override
    protected Mono<List<BucketInfo>> doHandle(ListBucketsOperation operation, S3GatewayContext context) {
        return Mono.fromFuture(() -> context.getS3Client().listBuckets(ListBucketsRequest.builder().build()))
                .map(response -> response.buckets().stream()
                        .map(bucket -> BucketInfo.builder()
                                .name(bucket.name())
                                .creationDate(bucket.creationDate())
                                .build())
                        .toList());
    }

    @Override
    public Class<ListBucketsOperation> getOperationType() {
        return ListBucketsOperation.class;
    }
}
