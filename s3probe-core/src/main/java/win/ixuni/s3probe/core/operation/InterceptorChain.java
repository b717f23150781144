package win.ixuni.s3probe.core.operation;

import reactor.core.publisher.Mono;

/**
 * Used in interceptors to invoke the next interceptor or the final handler.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, GatewayContext context);
}
