package win.ixuni.s3probe.gateway.s3;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.SdkHttpConfigurationOption;
import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.utils.AttributeMap;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.exception.InitializationException;
import win.ixuni.s3probe.core.gateway.AbstractStorageGateway;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.s3probe.core.operation.interceptor.TimeoutInterceptor;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;
import win.ixuni.s3probe.gateway.s3.handler.bucket.*;
import win.ixuni.s3probe.gateway.s3.handler.multipart.*;
import win.ixuni.s3probe.gateway.s3.handler.object.*;
import win.ixuni.s3probe.gateway.s3.interceptor.S3ErrorTranslationInterceptor;

import java.net.URI;

/**
 * S3 storage gateway
 * <p>
 * Talks to any S3-compatible endpoint (MinIO, Ceph RGW, AWS S3, ...) through the AWS SDK async client.
 */
@Slf4j
public class S3StorageGateway extends AbstractStorageGateway {

    private final S3GatewayContext gatewayContext;
    private final S3AsyncClient s3Client;

    public S3StorageGateway(ProbeProperties properties) {
        ProbeProperties.ConnectionConfig connection = properties.getConnection();
        this.s3Client = buildS3Client(connection);
        this.gatewayContext = S3GatewayContext.builder()
                .endpointUrl(connection.getEndpointUrl())
                .s3Client(s3Client)
                .build();

        registerHandlers(connection.getRegion());
        registerInterceptors(properties.getTimeouts());
        gatewayContext.setHandlerRegistry(handlerRegistry);
    }

    /**
     * For tests: wraps an existing client
     */
    S3StorageGateway(S3AsyncClient s3Client, String region, ProbeProperties.TimeoutConfig timeouts) {
        this.s3Client = s3Client;
        this.gatewayContext = S3GatewayContext.builder()
                .s3Client(s3Client)
                .build();
        registerHandlers(region);
        registerInterceptors(timeouts);
        gatewayContext.setHandlerRegistry(handlerRegistry);
    }

    private S3AsyncClient buildS3Client(ProbeProperties.ConnectionConfig connection) {
        String endpoint = connection.getEndpointUrl();
        String accessKey = connection.getAccessKey();
        String secretKey = connection.getSecretKey();

        if (accessKey == null || accessKey.isBlank() || secretKey == null || secretKey.isBlank()) {
            throw new InitializationException("S3 gateway: access-key and secret-key must be configured");
        }

        var builder = S3AsyncClient.builder()
                .region(Region.of(connection.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKey, secretKey)))
                .forcePathStyle(connection.isPathStyleAccess())
                .httpClient(buildHttpClient(connection.isVerifySsl()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.builder()
                                .numRetries(Math.max(0, connection.getMaxRetries()))
                                .build())
                        .build());

        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        } else {
            log.warn("S3 gateway: no endpoint configured, will use AWS default");
        }

        return builder.build();
    }

    private SdkAsyncHttpClient buildHttpClient(boolean verifySsl) {
        if (verifySsl) {
            return NettyNioAsyncHttpClient.builder().build();
        }
        log.warn("S3 gateway: TLS certificate verification is disabled");
        return NettyNioAsyncHttpClient.builder()
                .buildWithDefaults(AttributeMap.builder()
                        .put(SdkHttpConfigurationOption.TRUST_ALL_CERTIFICATES, Boolean.TRUE)
                        .build());
    }

    private void registerHandlers(String region) {
        // Bucket handlers (10)
        handlerRegistry.register(new S3CreateBucketHandler(region));
        handlerRegistry.register(new S3DeleteBucketHandler());
        handlerRegistry.register(new S3HeadBucketHandler());
        handlerRegistry.register(new S3ListBucketsHandler());
        handlerRegistry.register(new S3GetBucketVersioningHandler());
        handlerRegistry.register(new S3PutBucketVersioningHandler());
        handlerRegistry.register(new S3GetBucketTaggingHandler());
        handlerRegistry.register(new S3PutBucketTaggingHandler());
        handlerRegistry.register(new S3DeleteBucketTaggingHandler());
        handlerRegistry.register(new S3GetBucketPolicyHandler());

        // Object handlers (12)
        handlerRegistry.register(new S3PutObjectHandler());
        handlerRegistry.register(new S3GetObjectHandler());
        handlerRegistry.register(new S3HeadObjectHandler());
        handlerRegistry.register(new S3DeleteObjectHandler());
        handlerRegistry.register(new S3CopyObjectHandler());
        handlerRegistry.register(new S3ListObjectsHandler());
        handlerRegistry.register(new S3ListObjectsV2Handler());
        handlerRegistry.register(new S3ListObjectVersionsHandler());
        handlerRegistry.register(new S3GetObjectTaggingHandler());
        handlerRegistry.register(new S3PutObjectTaggingHandler());
        handlerRegistry.register(new S3DeleteObjectTaggingHandler());
        handlerRegistry.register(new S3GetObjectAttributesHandler());

        // Multipart handlers (6)
        handlerRegistry.register(new S3CreateMultipartUploadHandler());
        handlerRegistry.register(new S3UploadPartHandler());
        handlerRegistry.register(new S3CompleteMultipartUploadHandler());
        handlerRegistry.register(new S3AbortMultipartUploadHandler());
        handlerRegistry.register(new S3ListMultipartUploadsHandler());
        handlerRegistry.register(new S3ListPartsHandler());

        log.info("Registered {} operation handlers for S3 gateway", handlerRegistry.size());
    }

    private void registerInterceptors(ProbeProperties.TimeoutConfig timeouts) {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
        handlerRegistry.addInterceptor(new TimeoutInterceptor(
                timeouts.getOperation(), timeouts.getUpload(), timeouts.getDownload()));
        handlerRegistry.addInterceptor(new S3ErrorTranslationInterceptor());
        log.debug("Registered {} interceptors", handlerRegistry.interceptorCount());
    }

    @Override
    protected GatewayContext getGatewayContext() {
        return gatewayContext;
    }

    @Override
    public String getGatewayType() {
        return S3GatewayContext.GATEWAY_TYPE;
    }

    @Override
    public void close() {
        log.info("Shutting down S3 gateway: {}", gatewayContext.getTarget());
        s3Client.close();
    }
}
