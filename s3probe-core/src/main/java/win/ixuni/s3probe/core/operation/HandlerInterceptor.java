package win.ixuni.s3probe.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler interceptor
 * <p>
 * Wraps handler execution with common logic: logging, timeouts, error translation.
 */
public interface HandlerInterceptor {

    /**
     * Intercept handler execution. Implementors call {@code chain.proceed()} and decorate the result.
     *
     * @param operation the operation instance
     * @param context   gateway context
     * @param chain     remaining chain
     * @param <O>       operation type
     * @param <R>       result type
     * @return operation result
     */
    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            GatewayContext context,
            InterceptorChain<O, R> chain);

    /**
     * Lower values run first (outermost). Default 0.
     */
    default int getOrder() {
        return 0;
    }
}
