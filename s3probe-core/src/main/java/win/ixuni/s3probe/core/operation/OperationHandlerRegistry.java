package win.ixuni.s3probe.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.s3probe.core.exception.GatewayException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operation handler registry
 * <p>
 * A gateway registers one handler per verb at construction. Every execution passes through the
 * interceptors, lowest order outermost, before reaching the handler.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    /**
     * Sorted snapshot, replaced as a whole when an interceptor is added
     */
    private volatile List<HandlerInterceptor> interceptors = List.of();

    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        OperationHandler<?, ?> previous = handlers.put(handler.getOperationType(), handler);
        if (previous != null) {
            log.warn("Handler for {} replaced by {}", handler.getOperationType().getSimpleName(),
                    handler.getClass().getSimpleName());
        }
    }

    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.add(interceptor);
        sorted.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors = List.copyOf(sorted);
        log.debug("Added interceptor {} (order {})", interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * @return the operation result, or a {@code NotImplemented} (501) error when the gateway has no
     *         handler for the operation
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, GatewayContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlers.get(operation.getClass());
        if (handler == null) {
            return Mono.error(new GatewayException("NotImplemented",
                    context.getGatewayType() + " gateway does not implement " + operation.getOperationName(), 501));
        }

        // Wrap from the innermost interceptor outwards
        List<HandlerInterceptor> snapshot = interceptors;
        InterceptorChain<O, R> chain = handler::handle;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            HandlerInterceptor interceptor = snapshot.get(i);
            InterceptorChain<O, R> next = chain;
            chain = (op, ctx) -> interceptor.intercept(op, ctx, next);
        }
        return chain.proceed(operation, context);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    public int size() {
        return handlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }
}
