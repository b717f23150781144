package win.ixuni.s3probe.checks.category;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.mockito.stubbing.Answer;
import win.ixuni.s3probe.checks.MemoryCheckFixture;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.gateway.GatewayError;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Invalid names and keys against a gateway whose every call fails locally: only a validation refusal
 * counts as a rejection.
 */
class ErrorConditionChecksRejectionTest {

    private static final List<String> VALIDATION_RESULTS = List.of(
            "invalid_bucket_name_underscores", "invalid_bucket_name_capitals",
            "invalid_bucket_name_trailing_hyphen", "invalid_bucket_name_leading_hyphen",
            "invalid_bucket_name_too_long", "invalid_bucket_name_too_short",
            "invalid_bucket_name_consecutive_dots", "invalid_bucket_name_ip_address",
            "invalid_bucket_name_space", "invalid_bucket_name_empty",
            "invalid_object_key_empty", "invalid_object_key_too_long",
            "invalid_object_key_null_character", "invalid_object_key_control_character");

    /**
     * Provisions the scoped bucket, then fails every other call with {@code error}
     */
    private static StorageGateway gatewayFailingWith(GatewayError error) {
        Answer<Object> failing = invocation -> invocation.getMethod().getReturnType() == GatewayResult.class
                ? GatewayResult.failure(error)
                : Mockito.RETURNS_DEFAULTS.answer(invocation);
        StorageGateway gateway = mock(StorageGateway.class, failing);
        doReturn(GatewayResult.success(null), GatewayResult.failure(error))
                .when(gateway).createBucket(any(CreateBucketOperation.class));
        return gateway;
    }

    private static List<CheckResult> run(StorageGateway gateway) {
        ErrorConditionChecks checks = new ErrorConditionChecks(
                MemoryCheckFixture.context(gateway, ErrorConditionChecks.NAME));
        List<CheckResult> results = checks.runChecks();
        checks.cleanup();
        return results;
    }

    @Nested
    @DisplayName("Unreachable endpoint")
    class Unreachable {

        @Test
        @DisplayName("Connection refused fails every invalid name and key result")
        void networkErrorIsNotARejection() {
            GatewayError refused = new GatewayError(GatewayError.NETWORK_ERROR, 0,
                    "Unable to execute HTTP request: Connection refused");

            List<CheckResult> results = run(gatewayFailingWith(refused));

            VALIDATION_RESULTS.forEach(name -> MemoryCheckFixture.assertFailed(results, name));
            assertTrue(results.stream().filter(result -> VALIDATION_RESULTS.contains(result.getName()))
                    .noneMatch(CheckResult::isSuccess));
        }

        @Test
        @DisplayName("Generic client errors are not rejections either")
        void genericClientErrorIsNotARejection() {
            GatewayError failure = new GatewayError(GatewayError.CLIENT_ERROR, 0, "client closed");

            List<CheckResult> results = run(gatewayFailingWith(failure));

            VALIDATION_RESULTS.forEach(name -> MemoryCheckFixture.assertFailed(results, name));
        }
    }

    @Nested
    @DisplayName("Client-side validation")
    class ClientValidation {

        @Test
        @DisplayName("A request refused before sending counts as rejected")
        void validationRefusalPasses() {
            GatewayError refused = new GatewayError(GatewayError.CLIENT_VALIDATION, 0,
                    "Bucket name must not contain underscores");

            List<CheckResult> results = run(gatewayFailingWith(refused));

            VALIDATION_RESULTS.forEach(name -> MemoryCheckFixture.assertPassed(results, name));
            CheckResult first = MemoryCheckFixture.find(results, "invalid_bucket_name_underscores").orElseThrow();
            assertEquals(GatewayError.CLIENT_VALIDATION, first.getDetails().get("error_code"));
        }

        @Test
        @DisplayName("Missing resources still need a 404, not a local refusal")
        void validationRefusalDoesNotStandInForNotFound() {
            GatewayError refused = new GatewayError(GatewayError.CLIENT_VALIDATION, 0, "refused");

            List<CheckResult> results = run(gatewayFailingWith(refused));

            MemoryCheckFixture.assertFailed(results, "nonexistent_bucket_head_bucket");
            MemoryCheckFixture.assertFailed(results, "nonexistent_object_get_object");
        }
    }

    @Test
    @DisplayName("Copy of a missing object targets a freshly generated key")
    void copyTargetIsUnique() {
        StorageGateway gateway = gatewayFailingWith(new GatewayError("NoSuchKey", 404, "missing"));

        run(gateway);

        verify(gateway).copyObject(argThat(operation -> operation.getDestinationKey().startsWith("copy-dest-")
                && !operation.getDestinationKey().equals(operation.getSourceKey())));
    }
}
