package win.ixuni.s3probe.gateway.s3;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.GatewayFactory;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;

/**
 * S3 gateway factory
 */
@Slf4j
public class S3GatewayFactory implements GatewayFactory {

    @Override
    public String getGatewayType() {
        return S3GatewayContext.GATEWAY_TYPE;
    }

    @Override
    public StorageGateway createGateway(ProbeProperties properties) {
        log.info("Creating S3 gateway instance: {}", properties.getConnection().getEndpointUrl());
        return new S3StorageGateway(properties);
    }

    @Override
    public String getDescription() {
        return "S3-compatible endpoint via the AWS SDK for Java v2";
    }
}
