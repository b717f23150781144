package win.ixuni.s3probe.gateway.s3.handler;

import reactor.core.publisher.Mono;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.Operation;
import win.ixuni.s3probe.core.operation.OperationHandler;
import win.ixuni.s3probe.gateway.s3.context.S3GatewayContext;

/**
 * Base class of S3 handlers: narrows the context to {@link S3GatewayContext}
 *
 * @param <O> operation type
 * @param <R> result type
 */
public abstract class AbstractS3Handler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, GatewayContext context) {
        if (!(context instanceof S3GatewayContext s3Context)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected S3GatewayContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, s3Context);
    }

    protected abstract Mono<R> doHandle(O operation, S3GatewayContext context);
}
