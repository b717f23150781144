package win.ixuni.s3probe.core.operation;

import reactor.core.publisher.Mono;

/**
 * Operation handler interface
 * <p>
 * Each gateway provides one handler per supported operation.
 *
 * @param <O> operation type
 * @param <R> result type
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   gateway context
     * @return operation result; an empty Mono means a successful response without a body
     */
    Mono<R> handle(O operation, GatewayContext context);

    /**
     * @return the operation class this handler serves
     */
    Class<O> getOperationType();
}
