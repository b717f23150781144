package win.ixuni.s3probe.gateway.s3.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.OperationHandlerRegistry;

/**
 * S3 gateway context
 * <p>
 * Holds the AWS S3 async client and the endpoint it talks to
 */
@Getter
@Builder
public class S3GatewayContext implements GatewayContext {

    public static final String GATEWAY_TYPE = "s3";

    private final String endpointUrl;

    /**
     * AWS S3 async client
     */
    private final S3AsyncClient s3Client;

    /**
     * Operation handler registry (injected at runtime)
     */
    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getGatewayType() {
        return GATEWAY_TYPE;
    }

    @Override
    public String getTarget() {
        return endpointUrl != null ? endpointUrl : "aws";
    }
}
