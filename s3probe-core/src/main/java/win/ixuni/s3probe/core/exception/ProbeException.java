package win.ixuni.s3probe.core.exception;

import lombok.Getter;

/**
 * S3Probe base exception
 */
@Getter
public class ProbeException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public ProbeException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public ProbeException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
