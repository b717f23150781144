package win.ixuni.s3probe.gateway.s3.interceptor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.gateway.GatewayError;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.bucket.HeadBucketOperation;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class S3ErrorTranslationInterceptorTest {

    private final S3ErrorTranslationInterceptor interceptor = new S3ErrorTranslationInterceptor();

    private final GatewayContext context = mock(GatewayContext.class);

    private Mono<Void> failingCall(Throwable error) {
        return interceptor.intercept(new HeadBucketOperation("bucket"), context, (op, ctx) -> Mono.error(error));
    }

    private static GatewayException asGatewayException(Throwable error) {
        return assertInstanceOf(GatewayException.class, error);
    }

    @Nested
    @DisplayName("Service errors")
    class ServiceErrors {

        @Test
        @DisplayName("Keep code, status and request id")
        void serviceErrorIsTranslatedVerbatim() {
            S3Exception error = (S3Exception) S3Exception.builder()
                    .statusCode(409)
                    .requestId("req-1")
                    .awsErrorDetails(AwsErrorDetails.builder()
                            .errorCode("BucketAlreadyOwnedByYou")
                            .errorMessage("Your previous request to create the named bucket succeeded")
                            .build())
                    .build();

            StepVerifier.create(failingCall(new CompletionException(error)))
                    .expectErrorSatisfies(e -> {
                        GatewayException translated = asGatewayException(e);
                        assertEquals("BucketAlreadyOwnedByYou", translated.getErrorCode());
                        assertEquals(409, translated.getHttpStatus());
                        assertEquals("req-1", translated.getRawDetails().get("request_id"));
                        assertSame(error, translated.getCause());
                    })
                    .verify();
        }

        @Test
        @DisplayName("HEAD 404 without body gets a code from its status")
        void missingCodeIsDerivedFromStatus() {
            S3Exception error = (S3Exception) S3Exception.builder()
                    .statusCode(404)
                    .build();

            StepVerifier.create(failingCall(error))
                    .expectErrorSatisfies(e -> {
                        GatewayException translated = asGatewayException(e);
                        assertEquals("NotFound", translated.getErrorCode());
                        assertTrue(translated.toError().isNotFound());
                    })
                    .verify();
        }

        @Test
        void statusCodesMapToS3Names() {
            assertEquals("Forbidden", S3ErrorTranslationInterceptor.codeForStatus(403));
            assertEquals("InvalidRange", S3ErrorTranslationInterceptor.codeForStatus(416));
            assertEquals("HTTP503", S3ErrorTranslationInterceptor.codeForStatus(503));
        }
    }

    @Nested
    @DisplayName("Client-side failures")
    class ClientFailures {

        @Test
        @DisplayName("Connection refused is a network error, not a validation refusal")
        void connectionRefusedIsNetworkError() {
            SdkClientException error = SdkClientException.builder()
                    .message("Unable to execute HTTP request: Connection refused")
                    .cause(new ConnectException("Connection refused"))
                    .build();

            StepVerifier.create(failingCall(new CompletionException(error)))
                    .expectErrorSatisfies(e -> {
                        GatewayException translated = asGatewayException(e);
                        assertEquals(GatewayError.NETWORK_ERROR, translated.getErrorCode());
                        assertEquals(0, translated.getHttpStatus());
                        assertFalse(translated.toError().isClientValidation());
                    })
                    .verify();
        }

        @Test
        @DisplayName("Unresolvable host is a network error")
        void unknownHostIsNetworkError() {
            SdkClientException error = SdkClientException.builder()
                    .message("Received an UnknownHostException")
                    .cause(new UnknownHostException("s3.invalid"))
                    .build();

            StepVerifier.create(failingCall(error))
                    .expectErrorSatisfies(e ->
                            assertEquals(GatewayError.NETWORK_ERROR, asGatewayException(e).getErrorCode()))
                    .verify();
        }

        @Test
        @DisplayName("SDK call timeout is a network error")
        void callTimeoutIsNetworkError() {
            ApiCallTimeoutException error = ApiCallTimeoutException.builder()
                    .message("Client execution did not complete before the specified timeout")
                    .build();

            StepVerifier.create(failingCall(error))
                    .expectErrorSatisfies(e ->
                            assertEquals(GatewayError.NETWORK_ERROR, asGatewayException(e).getErrorCode()))
                    .verify();
        }

        @Test
        @DisplayName("Request refused before sending is a validation refusal")
        void requestRefusedLocallyIsValidation() {
            SdkClientException error = SdkClientException.create("Bucket name must not be null");

            StepVerifier.create(failingCall(error))
                    .expectErrorSatisfies(e -> {
                        GatewayException translated = asGatewayException(e);
                        assertEquals(GatewayError.CLIENT_VALIDATION, translated.getErrorCode());
                        assertEquals(0, translated.getHttpStatus());
                        assertTrue(translated.toError().isClientValidation());
                    })
                    .verify();
        }

        @Test
        @DisplayName("Other exceptions pass through untranslated")
        void otherErrorsPassThrough() {
            IllegalStateException error = new IllegalStateException("client closed");

            StepVerifier.create(failingCall(error))
                    .expectErrorMatches(e -> e == error)
                    .verify();
        }
    }
}
