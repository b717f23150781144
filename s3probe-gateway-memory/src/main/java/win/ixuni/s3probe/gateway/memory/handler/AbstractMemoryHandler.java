package win.ixuni.s3probe.gateway.memory.handler;

import reactor.core.publisher.Mono;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.Operation;
import win.ixuni.s3probe.core.operation.OperationHandler;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;

/**
 * Base class of memory handlers
 * <p>
 * Gives subclasses a typed context and runs their synchronous logic inside a Mono, so that a thrown
 * {@link win.ixuni.s3probe.core.exception.GatewayException} becomes an error signal and a null
 * result an empty response.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public abstract class AbstractMemoryHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, GatewayContext context) {
        if (!(context instanceof MemoryGatewayContext memoryContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected MemoryGatewayContext but got: " + context.getClass().getName()));
        }
        return Mono.fromCallable(() -> doHandle(operation, memoryContext));
    }

    /**
     * @return the result, or null for a response without a body
     */
    protected abstract R doHandle(O operation, MemoryGatewayContext context);
}
