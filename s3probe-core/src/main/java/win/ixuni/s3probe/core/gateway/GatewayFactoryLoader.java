package win.ixuni.s3probe.core.gateway;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3probe.core.exception.GatewayNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Gateway factory loader
 * <p>
 * Discovers {@link GatewayFactory} implementations declared in META-INF/services.
 */
@Slf4j
public final class GatewayFactoryLoader {

    private GatewayFactoryLoader() {
        // Utility class, not instantiable
    }

    public static List<GatewayFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static List<GatewayFactory> load(ClassLoader classLoader) {
        ServiceLoader<GatewayFactory> loader = ServiceLoader.load(GatewayFactory.class, classLoader);
        List<GatewayFactory> factories = new ArrayList<>();

        for (GatewayFactory factory : loader) {
            factories.add(factory);
            log.debug("Discovered gateway factory: {} - {}", factory.getGatewayType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No GatewayFactory implementations found on the classpath");
        }

        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory for a gateway type
     *
     * @throws GatewayNotFoundException when no factory serves the type
     */
    public static GatewayFactory find(String gatewayType) {
        return load().stream()
                .filter(factory -> factory.getGatewayType().equalsIgnoreCase(gatewayType))
                .findFirst()
                .orElseThrow(() -> new GatewayNotFoundException(gatewayType));
    }
}
