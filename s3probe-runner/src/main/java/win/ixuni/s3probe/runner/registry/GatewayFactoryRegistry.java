package win.ixuni.s3probe.runner.registry;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.s3probe.core.exception.GatewayNotFoundException;
import win.ixuni.s3probe.core.gateway.GatewayFactory;
import win.ixuni.s3probe.core.gateway.GatewayFactoryLoader;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gateway factory registry
 * <p>
 * Indexes the gateway factories found on the classpath by type.
 */
@Slf4j
@Component
public class GatewayFactoryRegistry {

    /**
     * Factory mapping: type -> factory
     */
    private final Map<String, GatewayFactory> factoryMap = new TreeMap<>();

    private final List<GatewayFactory> factories;

    public GatewayFactoryRegistry() {
        this(GatewayFactoryLoader.load());
    }

    public GatewayFactoryRegistry(List<GatewayFactory> factories) {
        this.factories = factories;
    }

    @PostConstruct
    public void initialize() {
        for (GatewayFactory factory : factories) {
            GatewayFactory previous = factoryMap.put(factory.getGatewayType().toLowerCase(Locale.ROOT), factory);
            if (previous != null) {
                log.warn("Gateway type '{}' registered twice, {} replaces {}", factory.getGatewayType(),
                        factory.getClass().getName(), previous.getClass().getName());
            }
            log.debug("Registered gateway factory: {} - {}", factory.getGatewayType(), factory.getDescription());
        }
        log.info("Gateway registry initialized with types {}", factoryMap.keySet());
    }

    /**
     * @throws GatewayNotFoundException when no factory serves the type
     */
    public GatewayFactory resolve(String gatewayType) {
        GatewayFactory factory = gatewayType != null ? factoryMap.get(gatewayType.toLowerCase(Locale.ROOT)) : null;
        if (factory == null) {
            throw new GatewayNotFoundException(gatewayType);
        }
        return factory;
    }

    public Collection<GatewayFactory> getFactories() {
        return Collections.unmodifiableCollection(factoryMap.values());
    }
}
