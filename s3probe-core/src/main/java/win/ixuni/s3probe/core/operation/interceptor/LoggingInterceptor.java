package win.ixuni.s3probe.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.HandlerInterceptor;
import win.ixuni.s3probe.core.operation.InterceptorChain;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.concurrent.TimeUnit;

/**
 * Traces every gateway call with its duration and outcome.
 * <p>
 * Failures are logged at debug: most of them are what the issuing probe expects.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            GatewayContext context,
            InterceptorChain<O, R> chain) {
        if (!log.isDebugEnabled()) {
            return chain.proceed(operation, context);
        }
        String call = context.getGatewayType() + " " + operation.getOperationName();
        return Mono.defer(() -> {
            long started = System.nanoTime();
            log.debug("-> {} on {}", call, context.getTarget());
            return chain.proceed(operation, context)
                    .doOnSuccess(result -> log.debug("<- {} ok in {}ms", call, elapsedMillis(started)))
                    .doOnError(error -> log.debug("<- {} failed in {}ms: {}", call, elapsedMillis(started),
                            error.getMessage()));
        });
    }

    private static long elapsedMillis(long started) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
