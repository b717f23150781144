package win.ixuni.s3probe.gateway.memory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.GatewayFactory;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;

/**
 * In-memory gateway factory
 */
@Slf4j
public class MemoryGatewayFactory implements GatewayFactory {

    @Override
    public String getGatewayType() {
        return MemoryGatewayContext.GATEWAY_TYPE;
    }

    @Override
    public StorageGateway createGateway(ProbeProperties properties) {
        log.info("Creating memory gateway instance");
        return new MemoryStorageGateway("s3probe", properties.getTimeouts());
    }

    @Override
    public String getDescription() {
        return "In-process S3 emulation for dry runs and self-tests";
    }
}
