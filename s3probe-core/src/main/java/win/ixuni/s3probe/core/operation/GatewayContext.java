package win.ixuni.s3probe.core.operation;

import reactor.core.publisher.Mono;

/**
 * Gateway context
 * <p>
 * Shared dependencies handlers need to execute operations. Each gateway implements its own context.
 */
public interface GatewayContext {

    /**
     * @return gateway type, e.g. "s3", "memory"
     */
    String getGatewayType();

    /**
     * @return target description used in log lines (endpoint URL, store name)
     */
    String getTarget();

    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Called during gateway construction to inject the handler registry.
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute another operation through the registry, e.g. a handler that needs a HeadObject first.
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}
