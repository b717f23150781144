package win.ixuni.s3probe.core.gateway;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.Operation;
import win.ixuni.s3probe.core.operation.OperationHandler;
import win.ixuni.s3probe.core.operation.TestGatewayContext;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.s3probe.core.operation.bucket.HeadBucketOperation;
import win.ixuni.s3probe.core.operation.bucket.ListBucketsOperation;

import java.io.UncheckedIOException;
import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;

class AbstractStorageGatewayTest {

    private StubGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new StubGateway();
        gateway.getHandlerRegistry().register(handler(CreateBucketOperation.class, Mono.empty()));
        gateway.getHandlerRegistry().register(handler(HeadBucketOperation.class,
                Mono.error(GatewayException.noSuchBucket("missing"))));
        gateway.getHandlerRegistry().register(handler(DeleteBucketOperation.class,
                Mono.error(new IllegalArgumentException("bucket name rejected locally"))));
    }

    @Test
    void success() {
        assertTrue(gateway.createBucket(new CreateBucketOperation("b")).isSuccess());
    }

    @Test
    @DisplayName("Gateway exceptions keep their code and status")
    void gatewayException() {
        GatewayError error = gateway.headBucket(new HeadBucketOperation("missing")).getError();

        assertEquals("NoSuchBucket", error.getCode());
        assertEquals(404, error.getHttpStatus());
    }

    @Test
    @DisplayName("Argument failures become ClientValidation with status 0")
    void clientValidation() {
        GatewayError error = gateway.deleteBucket(new DeleteBucketOperation("b")).getError();

        assertEquals(GatewayError.CLIENT_VALIDATION, error.getCode());
        assertEquals(0, error.getHttpStatus());
        assertTrue(error.isClientValidation());
        assertEquals("bucket name rejected locally", error.getMessage());
        assertEquals(IllegalArgumentException.class.getName(), error.getRawDetails().get("exception"));
    }

    @Test
    @DisplayName("Connection failures become NetworkError, never a validation refusal")
    void networkError() {
        gateway.getHandlerRegistry().register(handler(HeadBucketOperation.class,
                Mono.error(new UncheckedIOException(new ConnectException("Connection refused")))));

        GatewayError error = gateway.headBucket(new HeadBucketOperation("b")).getError();

        assertEquals(GatewayError.NETWORK_ERROR, error.getCode());
        assertEquals(0, error.getHttpStatus());
        assertFalse(error.isClientValidation());
    }

    @Test
    @DisplayName("Other local failures become ClientError")
    void otherClientError() {
        gateway.getHandlerRegistry().register(handler(HeadBucketOperation.class,
                Mono.error(new IllegalStateException("client closed"))));

        GatewayError error = gateway.headBucket(new HeadBucketOperation("b")).getError();

        assertEquals(GatewayError.CLIENT_ERROR, error.getCode());
        assertFalse(error.isClientValidation());
    }

    @Test
    @DisplayName("Operations without a handler report 501")
    void unsupportedOperation() {
        GatewayError error = gateway.listBuckets(new ListBucketsOperation()).getError();

        assertEquals(501, error.getHttpStatus());
    }

    private static <O extends Operation<Void>> OperationHandler<O, Void> handler(Class<O> type,
                                                                            Mono<Void> outcome) {
        return new OperationHandler<>() {
            @Override
            public Mono<Void> handle(O operation, GatewayContext context) {
                return outcome;
            }

            @Override
            public Class<O> getOperationType() {
                return type;
            }
        };
    }

    private static class StubGateway extends AbstractStorageGateway {

        private final TestGatewayContext context = new TestGatewayContext();

        @Override
        protected GatewayContext getGatewayContext() {
            return context;
        }

        @Override
        public String getGatewayType() {
            return "stub";
        }
    }
}
