package win.ixuni.s3probe.core.gateway;

import win.ixuni.s3probe.core.config.ProbeProperties;

/**
 * Gateway factory interface
 * <p>
 * Each gateway type provides a factory, discovered through {@link GatewayFactoryLoader}.
 */
public interface GatewayFactory {

    /**
     * @return gateway type identifier matched against {@code s3probe.gateway.type}
     */
    String getGatewayType();

    StorageGateway createGateway(ProbeProperties properties);

    default String getDescription() {
        return getGatewayType() + " storage gateway";
    }
}
