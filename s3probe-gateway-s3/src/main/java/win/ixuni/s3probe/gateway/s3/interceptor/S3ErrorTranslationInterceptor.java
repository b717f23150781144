package win.ixuni.s3probe.gateway.s3.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.HandlerInterceptor;
import win.ixuni.s3probe.core.operation.InterceptorChain;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * S3 error translation interceptor
 * <p>
 * Converts AWS SDK exceptions to {@link GatewayException}, keeping the S3 error code and HTTP status
 * exactly as the backend sent them. Responses without a body (HEAD) carry no error code; one is
 * derived from the status.
 */
@Slf4j
public class S3ErrorTranslationInterceptor implements HandlerInterceptor {

    private static final String UNABLE_TO_EXECUTE = "Unable to execute HTTP request";

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, GatewayContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(e -> unwrap(e) instanceof S3Exception || unwrap(e) instanceof SdkClientException,
                        e -> translate(unwrap(e)));
    }

    Throwable translate(Throwable error) {
        if (error instanceof S3Exception s3Exception) {
            return translateServiceError(s3Exception);
        }
        log.debug("Client-side failure: {}", error.toString());
        if (isTransportFailure(error)) {
            return GatewayException.networkError(error);
        }
        // The SDK refused to build or sign the request
        return GatewayException.clientValidation(error);
    }

    /**
     * The SDK reports connection and socket faults as {@link SdkClientException} wrapping the I/O cause;
     * its own call timeouts carry no cause at all.
     */
    static boolean isTransportFailure(Throwable error) {
        return GatewayException.isTransportFailure(error)
                || error instanceof ApiCallTimeoutException
                || error instanceof ApiCallAttemptTimeoutException
                || (error.getMessage() != null && error.getMessage().startsWith(UNABLE_TO_EXECUTE));
    }

    private GatewayException translateServiceError(S3Exception e) {
        int status = e.statusCode();
        String errorCode = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        if (errorCode == null || errorCode.isBlank()) {
            errorCode = codeForStatus(status);
        }
        String message = e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null
                ? e.awsErrorDetails().errorMessage()
                : e.getMessage();

        Map<String, Object> raw = new LinkedHashMap<>();
        if (e.requestId() != null) {
            raw.put("request_id", e.requestId());
        }
        if (e.extendedRequestId() != null) {
            raw.put("extended_request_id", e.extendedRequestId());
        }
        if (e.awsErrorDetails() != null && e.awsErrorDetails().serviceName() != null) {
            raw.put("service", e.awsErrorDetails().serviceName());
        }
        return new GatewayException(errorCode, message, status, raw, e);
    }

    static String codeForStatus(int status) {
        return switch (status) {
            case 400 -> "BadRequest";
            case 403 -> "Forbidden";
            case 404 -> "NotFound";
            case 405 -> "MethodNotAllowed";
            case 409 -> "Conflict";
            case 412 -> "PreconditionFailed";
            case 416 -> "InvalidRange";
            case 501 -> "NotImplemented";
            default -> "HTTP" + status;
        };
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public int getOrder() {
        // Innermost: the timeout and logging interceptors see translated errors
        return 100;
    }
}
