package win.ixuni.s3probe.core.gateway;

import lombok.Value;

import java.util.Map;

/**
 * Normalized failure of a gateway operation.
 * <p>
 * {@code httpStatus} is 0 when the request never produced an HTTP response
 * (connection failure, timeout, client-side validation).
 */
@Value
public class GatewayError {

    /**
     * The client library refused to send a malformed request
     */
    public static final String CLIENT_VALIDATION = "ClientValidation";

    /**
     * Connection, DNS or socket failure; the endpoint never answered
     */
    public static final String NETWORK_ERROR = "NetworkError";

    /**
     * Any other local failure
     */
    public static final String CLIENT_ERROR = "ClientError";

    /**
     * S3 error code, e.g. "NoSuchBucket", "InvalidBucketName", "RequestTimeout"
     */
    String code;

    int httpStatus;

    String message;

    Map<String, Object> rawDetails;

    public GatewayError(String code, int httpStatus, String message, Map<String, Object> rawDetails) {
        this.code = code != null ? code : "";
        this.httpStatus = httpStatus;
        this.message = message;
        this.rawDetails = rawDetails != null ? Map.copyOf(rawDetails) : Map.of();
    }

    public GatewayError(String code, int httpStatus, String message) {
        this(code, httpStatus, message, Map.of());
    }

    public boolean hasStatus(int... statuses) {
        for (int status : statuses) {
            if (httpStatus == status) {
                return true;
            }
        }
        return false;
    }

    public boolean hasCode(String... codes) {
        for (String candidate : codes) {
            if (code.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True only for a request refused locally as invalid, never for a transport failure
     */
    public boolean isClientValidation() {
        return httpStatus == 0 && CLIENT_VALIDATION.equals(code);
    }

    public boolean isNotFound() {
        return httpStatus == 404;
    }

    /**
     * Compact form used in result messages, e.g. "NoSuchKey (404): The specified key does not exist"
     */
    public String describe() {
        return code + " (" + httpStatus + "): " + message;
    }
}
