package win.ixuni.s3probe.core.operation.interceptor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.Operation;
import win.ixuni.s3probe.core.operation.TestGatewayContext;
import win.ixuni.s3probe.core.operation.bucket.HeadBucketOperation;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutInterceptorTest {

    private final TimeoutInterceptor interceptor = new TimeoutInterceptor(
            Duration.ofMillis(50), Duration.ofSeconds(300), Duration.ofSeconds(120));

    @Test
    @DisplayName("Expiry surfaces as RequestTimeout with status 0")
    void timeoutBecomesGatewayException() {
        Mono<Void> result = interceptor.intercept(new HeadBucketOperation("b"), new TestGatewayContext(),
                (operation, context) -> Mono.<Void>never());

        StepVerifier.create(result)
                .expectErrorSatisfies(error -> {
                    GatewayException gatewayException = assertInstanceOf(GatewayException.class, error);
                    assertEquals("RequestTimeout", gatewayException.getErrorCode());
                    assertEquals(0, gatewayException.getHttpStatus());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Fast operations pass through untouched")
    void passThrough() {
        Mono<String> result = interceptor.intercept(new StringOperation(), new TestGatewayContext(),
                (operation, context) -> Mono.just("done"));

        StepVerifier.create(result).expectNext("done").verifyComplete();
    }

    @Test
    @DisplayName("Uploads and downloads have their own timeouts")
    void timeoutClasses() {
        assertEquals(Duration.ofMillis(50), interceptor.timeoutFor(Operation.TimeoutClass.STANDARD));
        assertEquals(Duration.ofSeconds(300), interceptor.timeoutFor(Operation.TimeoutClass.UPLOAD));
        assertEquals(Duration.ofSeconds(120), interceptor.timeoutFor(Operation.TimeoutClass.DOWNLOAD));
    }

    private static class StringOperation implements Operation<String> {
    }
}
