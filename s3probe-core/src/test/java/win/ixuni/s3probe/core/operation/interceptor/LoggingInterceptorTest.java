package win.ixuni.s3probe.core.operation.interceptor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.TestGatewayContext;
import win.ixuni.s3probe.core.operation.bucket.HeadBucketOperation;

import static org.junit.jupiter.api.Assertions.*;

class LoggingInterceptorTest {

    private final LoggingInterceptor interceptor = new LoggingInterceptor();

    @Test
    @DisplayName("Errors are propagated unchanged")
    void propagatesErrors() {
        GatewayException failure = GatewayException.noSuchBucket("b");

        StepVerifier.create(interceptor.intercept(new HeadBucketOperation("b"), new TestGatewayContext(),
                        (operation, context) -> Mono.<Void>error(failure)))
                .expectErrorMatches(error -> error == failure)
                .verify();
    }

    @Test
    @DisplayName("Runs outermost")
    void order() {
        assertTrue(interceptor.getOrder() < new TimeoutInterceptor(null, null, null).getOrder());
    }
}
