package win.ixuni.s3probe.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.HandlerInterceptor;
import win.ixuni.s3probe.core.operation.InterceptorChain;
import win.ixuni.s3probe.core.operation.Operation;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Applies the configured per-operation timeout. Expiry surfaces as a {@code RequestTimeout}
 * gateway failure with status 0, exactly like any other backend failure.
 */
@Slf4j
public class TimeoutInterceptor implements HandlerInterceptor {

    private final Duration operationTimeout;
    private final Duration uploadTimeout;
    private final Duration downloadTimeout;

    public TimeoutInterceptor(Duration operationTimeout, Duration uploadTimeout, Duration downloadTimeout) {
        this.operationTimeout = operationTimeout;
        this.uploadTimeout = uploadTimeout;
        this.downloadTimeout = downloadTimeout;
    }

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            GatewayContext context,
            InterceptorChain<O, R> chain) {
        Duration timeout = timeoutFor(operation.getTimeoutClass());
        return chain.proceed(operation, context)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> {
                    log.warn("[{}] Operation {} timed out after {}",
                            context.getGatewayType(), operation.getOperationName(), timeout);
                    return new GatewayException("RequestTimeout",
                            operation.getOperationName() + " did not complete within " + timeout, 0,
                            Map.of("timeout", timeout.toString()), e);
                });
    }

    Duration timeoutFor(Operation.TimeoutClass timeoutClass) {
        return switch (timeoutClass) {
            case UPLOAD -> uploadTimeout;
            case DOWNLOAD -> downloadTimeout;
            case STANDARD -> operationTimeout;
        };
    }

    @Override
    public int getOrder() {
        return -50;
    }
}
