package win.ixuni.s3probe.core.exception;

/**
 * Raised when the checker cannot be brought into a runnable state
 * (invalid configuration, unreachable endpoint, no usable gateway).
 */
public class InitializationException extends ProbeException {

    public InitializationException(String message) {
        super("InitializationFailed", message, 0);
    }

    public InitializationException(String message, Throwable cause) {
        super("InitializationFailed", message, 0, cause);
    }
}
