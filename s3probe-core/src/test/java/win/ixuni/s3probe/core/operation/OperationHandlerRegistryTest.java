package win.ixuni.s3probe.core.operation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;
import win.ixuni.s3probe.core.operation.bucket.HeadBucketOperation;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationHandlerRegistryTest {

    private OperationHandlerRegistry registry;
    private TestGatewayContext context;

    @BeforeEach
    void setUp() {
        registry = new OperationHandlerRegistry();
        context = new TestGatewayContext();
        context.setHandlerRegistry(registry);
        registry.register(new OperationHandler<CreateBucketOperation, Void>() {
            @Override
            public Mono<Void> handle(CreateBucketOperation operation, GatewayContext ctx) {
                return Mono.empty();
            }

            @Override
            public Class<CreateBucketOperation> getOperationType() {
                return CreateBucketOperation.class;
            }
        });
    }

    @Test
    @DisplayName("Unregistered operations fail with NotImplemented (501)")
    void missingHandler() {
        StepVerifier.create(registry.execute(new HeadBucketOperation("b"), context))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(GatewayException.class, error);
                    assertEquals("NotImplemented", ((GatewayException) error).getErrorCode());
                    assertEquals(501, ((GatewayException) error).getHttpStatus());
                })
                .verify();
    }

    @Test
    @DisplayName("Interceptors wrap the handler, lowest order outermost")
    void interceptorOrder() {
        List<String> calls = new ArrayList<>();
        registry.addInterceptor(recording("inner", 10, calls));
        registry.addInterceptor(recording("outer", -10, calls));

        StepVerifier.create(registry.execute(new CreateBucketOperation("b"), context)).verifyComplete();

        assertEquals(List.of("outer", "inner"), calls);
        assertEquals(2, registry.interceptorCount());
        assertTrue(registry.supports(CreateBucketOperation.class));
    }

    private HandlerInterceptor recording(String name, int order, List<String> calls) {
        return new HandlerInterceptor() {
            @Override
            public <O extends Operation<R>, R> Mono<R> intercept(O operation, GatewayContext ctx,
                                                                 InterceptorChain<O, R> chain) {
                calls.add(name);
                return chain.proceed(operation, ctx);
            }

            @Override
            public int getOrder() {
                return order;
            }
        };
    }
}
