package win.ixuni.s3probe.core.exception;

/**
 * Gateway type not found exception
 */
public class GatewayNotFoundException extends ProbeException {

    public GatewayNotFoundException(String gatewayType) {
        super("GatewayNotFound", "No storage gateway registered for type: " + gatewayType, 0);
    }
}
