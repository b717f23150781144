package win.ixuni.s3probe.core.check;

import win.ixuni.s3probe.core.gateway.GatewayError;

/**
 * Teardown failure of one cleanup item. Reported as a warning, never as a check failure.
 */
public record CleanupError(CleanupItem item, String code, int httpStatus, String message) {

    public static CleanupError of(CleanupItem item, GatewayError error) {
        return new CleanupError(item, error.getCode(), error.getHttpStatus(), error.getMessage());
    }

    public static CleanupError of(CleanupItem item, RuntimeException exception) {
        return new CleanupError(item, exception.getClass().getSimpleName(), 0, String.valueOf(exception.getMessage()));
    }

    @Override
    public String toString() {
        return "Failed to clean up " + item.describe() + ": " + code + " (" + httpStatus + ") " + message;
    }
}
