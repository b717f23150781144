package win.ixuni.s3probe.gateway.s3.handler.object;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import win.ixuni.s3probe.core.model.ObjectContent;
import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.operation.object.GetObjectOperation;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.AbstractS3Handler;

/**
 * S3 get object handler
 * <p>
 * Buffers the body: probes compare content byte for byte. The status code is taken from the
 * HTTP response so that a server ignoring a Range header is visible as a 200.
 */
public class S3GetObjectHandler extends AbstractS3Handler<GetObjectOperation, ObjectContent> {

    @Override
    protected Mono<ObjectContent> doHandle(GetObjectOperation operation, S3GatewayContext context) {
        var requestBuilder = GetObjectRequest.builder()
                .bucket(operation.getBucketName())
                .key(operation.getKey())
                .range(operation.getRange())
                .versionId(operation.getVersionId());
        if (operation.getIfRange() != null) {
            requestBuilder.overrideConfiguration(AwsRequestOverrideConfiguration.builder()
                    .putHeader("If-Range", operation.getIfRange())
                    .build());
        }

        return Mono.fromFuture(() -> context.getS3Client().getObject(
                        requestBuilder.build(),
                        AsyncResponseTransformer.toBytes()))
                .map(bytes -> toContent(operation, bytes));
    }

    private ObjectContent toContent(GetObjectOperation operation, ResponseBytes<GetObjectResponse> bytes) {
        GetObjectResponse response = bytes.response();
        int status = response.sdkHttpResponse() != null
                ? response.sdkHttpResponse().statusCode()
                : (response.contentRange() != null ? 206 : 200);

        ObjectMetadata metadata = ObjectMetadata.builder()
                .bucketName(operation.getBucketName())
                .key(operation.getKey())
                .contentLength(response.contentLength())
                .etag(response.eTag())
                .contentType(response.contentType())
                .lastModified(response.lastModified())
                .versionId(response.versionId())
                .storageClass(response.storageClassAsString())
                .userMetadata(response.metadata())
                .contentEncoding(response.contentEncoding())
                .contentDisposition(response.contentDisposition())
                .contentLanguage(response.contentLanguage())
                .cacheControl(response.cacheControl())
                .expires(response.expires())
                .build();

        return ObjectContent.builder()
                .statusCode(status)
                .contentRange(response.contentRange())
                .metadata(metadata)
                .data(bytes.asByteArray())
                .build();
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
