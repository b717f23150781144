package win.ixuni.s3probe.core.exception;

import lombok.Getter;
import win.ixuni.s3probe.core.gateway.GatewayError;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Backend failure raised inside a gateway's reactive pipeline.
 * <p>
 * Handlers and interceptors throw this; the gateway facade turns it into a {@link GatewayError}
 * so that probes never see an exception.
 */
@Getter
public class GatewayException extends ProbeException {

    /**
     * Raw response details (request id, extended code, headers of interest)
     */
    private final Map<String, Object> rawDetails;

    public GatewayException(String errorCode, String message, int httpStatus) {
        this(errorCode, message, httpStatus, Map.of(), null);
    }

    public GatewayException(String errorCode, String message, int httpStatus,
                            Map<String, Object> rawDetails, Throwable cause) {
        super(errorCode, message, httpStatus, cause);
        this.rawDetails = rawDetails != null ? rawDetails : Map.of();
    }

    public GatewayError toError() {
        return new GatewayError(getErrorCode(), getHttpStatus(), getMessage(), rawDetails);
    }

    public static GatewayException noSuchBucket(String bucketName) {
        return new GatewayException("NoSuchBucket", "The specified bucket does not exist: " + bucketName, 404);
    }

    public static GatewayException noSuchKey(String bucketName, String key) {
        return new GatewayException("NoSuchKey", "The specified key does not exist: " + bucketName + "/" + key, 404);
    }

    public static GatewayException noSuchUpload(String uploadId) {
        return new GatewayException("NoSuchUpload", "The specified upload does not exist: " + uploadId, 404);
    }

    public static GatewayException invalidArgument(String message) {
        return new GatewayException("InvalidArgument", message, 400);
    }

    /**
     * Failure that never produced an HTTP response, classified by its cause chain: transport faults
     * become {@code NetworkError}, argument checks {@code ClientValidation}, the rest {@code ClientError}.
     */
    public static GatewayException clientFailure(Throwable error) {
        if (isTransportFailure(error)) {
            return networkError(error);
        }
        if (error instanceof IllegalArgumentException) {
            return clientValidation(error);
        }
        return local(GatewayError.CLIENT_ERROR, error);
    }

    public static GatewayException networkError(Throwable error) {
        return local(GatewayError.NETWORK_ERROR, error);
    }

    public static GatewayException clientValidation(Throwable error) {
        return local(GatewayError.CLIENT_VALIDATION, error);
    }

    /**
     * True when an {@link IOException} or a timeout appears anywhere in the cause chain
     */
    public static boolean isTransportFailure(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof IOException || current instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static GatewayException local(String code, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new GatewayException(code, message, 0, Map.of("exception", error.getClass().getName()), error);
    }
}
