package win.ixuni.s3probe.gateway.memory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.AbstractStorageGateway;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.s3probe.core.operation.interceptor.TimeoutInterceptor;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;
import win.ixuni.s3probe.gateway.memory.handler.bucket.*;
import win.ixuni.s3probe.gateway.memory.handler.multipart.*;
import win.ixuni.s3probe.gateway.memory.handler.object.*;

/**
 * In-process storage gateway
 * <p>
 * Implements every verb against {@link MemoryGatewayContext} with S3's validation rules and error
 * codes. Used for dry runs and for testing the probes themselves.
 */
@Slf4j
public class MemoryStorageGateway extends AbstractStorageGateway {

    private final MemoryGatewayContext gatewayContext;

    public MemoryStorageGateway(String storeName, ProbeProperties.TimeoutConfig timeouts) {
        this.gatewayContext = MemoryGatewayContext.builder()
                .storeName(storeName)
                .build();
        registerHandlers();
        handlerRegistry.addInterceptor(new LoggingInterceptor());
        handlerRegistry.addInterceptor(new TimeoutInterceptor(
                timeouts.getOperation(), timeouts.getUpload(), timeouts.getDownload()));
        gatewayContext.setHandlerRegistry(handlerRegistry);
    }

    public MemoryStorageGateway(String storeName) {
        this(storeName, new ProbeProperties.TimeoutConfig());
    }

    private void registerHandlers() {
        // Bucket handlers (10)
        handlerRegistry.register(new MemoryCreateBucketHandler());
        handlerRegistry.register(new MemoryDeleteBucketHandler());
        handlerRegistry.register(new MemoryHeadBucketHandler());
        handlerRegistry.register(new MemoryListBucketsHandler());
        handlerRegistry.register(new MemoryGetBucketVersioningHandler());
        handlerRegistry.register(new MemoryPutBucketVersioningHandler());
        handlerRegistry.register(new MemoryGetBucketTaggingHandler());
        handlerRegistry.register(new MemoryPutBucketTaggingHandler());
        handlerRegistry.register(new MemoryDeleteBucketTaggingHandler());
        handlerRegistry.register(new MemoryGetBucketPolicyHandler());

        // Object handlers (12)
        handlerRegistry.register(new MemoryPutObjectHandler());
        handlerRegistry.register(new MemoryGetObjectHandler());
        handlerRegistry.register(new MemoryHeadObjectHandler());
        handlerRegistry.register(new MemoryDeleteObjectHandler());
        handlerRegistry.register(new MemoryCopyObjectHandler());
        handlerRegistry.register(new MemoryListObjectsHandler());
        handlerRegistry.register(new MemoryListObjectsV2Handler());
        handlerRegistry.register(new MemoryListObjectVersionsHandler());
        handlerRegistry.register(new MemoryGetObjectTaggingHandler());
        handlerRegistry.register(new MemoryPutObjectTaggingHandler());
        handlerRegistry.register(new MemoryDeleteObjectTaggingHandler());
        handlerRegistry.register(new MemoryGetObjectAttributesHandler());

        // Multipart handlers (6)
        handlerRegistry.register(new MemoryCreateMultipartUploadHandler());
        handlerRegistry.register(new MemoryUploadPartHandler());
        handlerRegistry.register(new MemoryCompleteMultipartUploadHandler());
        handlerRegistry.register(new MemoryAbortMultipartUploadHandler());
        handlerRegistry.register(new MemoryListMultipartUploadsHandler());
        handlerRegistry.register(new MemoryListPartsHandler());

        log.info("Registered {} operation handlers for memory gateway", handlerRegistry.size());
    }

    @Override
    protected GatewayContext getGatewayContext() {
        return gatewayContext;
    }

    @Override
    public String getGatewayType() {
        return MemoryGatewayContext.GATEWAY_TYPE;
    }

    /**
     * Direct access to the store, for assertions in tests
     */
    public MemoryGatewayContext getStore() {
        return gatewayContext;
    }

    @Override
    public void close() {
        log.info("Shutting down memory gateway: {}", gatewayContext.getStoreName());
        gatewayContext.getBuckets().clear();
        gatewayContext.getMultipartUploads().clear();
    }
}
