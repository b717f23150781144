package win.ixuni.s3probe.core.operation;

/**
 * Minimal context for exercising the registry without a backend
 */
public class TestGatewayContext implements GatewayContext {

    private OperationHandlerRegistry registry;

    @Override
    public String getGatewayType() {
        return "test";
    }

    @Override
    public String getTarget() {
        return "test://local";
    }

    @Override
    public OperationHandlerRegistry getHandlerRegistry() {
        return registry;
    }

    @Override
    public void setHandlerRegistry(OperationHandlerRegistry registry) {
        this.registry = registry;
    }
}
