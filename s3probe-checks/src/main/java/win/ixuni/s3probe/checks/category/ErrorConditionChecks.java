package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.gateway.GatewayError;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.bucket.*;
import win.ixuni.s3probe.core.operation.multipart.CompleteMultipartUploadOperation;
import win.ixuni.s3probe.core.operation.object.*;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Error handling: invalid names and keys, operations on missing resources, malformed requests,
 * permissions, invalid parameters, size limits and conflicts.
 * <p>
 * Most probes here expect a rejection; an unexpected success fails the probe.
 */
public class ErrorConditionChecks implements CheckCategory {

    public static final String NAME = "error_conditions";

    static final Map<String, String> INVALID_BUCKET_NAMES = Details.cases(
            "underscores", "bucket_with_underscores",
            "capitals", "BUCKET-WITH-CAPITALS",
            "trailing_hyphen", "bucket-",
            "leading_hyphen", "-bucket",
            "too_long", "a".repeat(64),
            "too_short", "ab",
            "consecutive_dots", "bucket..name",
            "ip_address", "192.168.1.1",
            "space", "bucket name",
            "empty", "");

    static final Map<String, String> INVALID_OBJECT_KEYS = Details.cases(
            "empty", "",
            "too_long", "/" + "a".repeat(1024),
            "null_character", "object\u0000null",
            "control_character", "object\u0001control");

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final Logger log;

    public ErrorConditionChecks(CategoryContext context) {
        this.runner = new CategoryRunner(NAME, context);
        this.gateway = context.getGateway();
        this.log = context.getLogger();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CheckResult> runChecks() {
        log.info("Starting error condition compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("invalid_bucket_operations", this::checkInvalidBucketOperations);
        runner.probe("invalid_object_operations", this::checkInvalidObjectOperations);
        runner.probe("malformed_requests", this::checkMalformedRequests);
        runner.probe("bucket_policy_access", this::checkPermissionErrors);
        runner.probe("missing_resources", this::checkResourceNotFound);
        runner.probe("invalid_version_id", this::checkInvalidParameters);
        runner.probe("large_metadata_limit", this::checkSizeLimits);
        runner.probe("conflicts", this::checkConflicts);

        log.info("Error condition checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    /**
     * Like {@link CategoryRunner#expectRejection}, but a request the client library refused to send
     * as invalid also counts as rejected. Network failures do not.
     */
    private void expectValidationRejection(String name, String scenario, GatewayResult<?> result, long start) {
        if (result.isFailure() && result.getError().isClientValidation()) {
            Map<String, Object> details = CategoryRunner.errorDetails(result.getError());
            details.put("scenario", scenario);
            details.put("note", "Rejected by the client before reaching the endpoint");
            runner.pass(name, scenario + " rejected client-side", details, start);
            return;
        }
        runner.expectRejection(name, scenario, result, start, CheckPolicies.VALIDATION_ERROR);
    }

    private void checkInvalidBucketOperations() {
        INVALID_BUCKET_NAMES.forEach((suffix, bucketName) -> {
            long start = CategoryRunner.startTimer();
            GatewayResult<Void> created = gateway.createBucket(new CreateBucketOperation(bucketName));
            if (created.isSuccess()) {
                runner.addCleanupItem(CleanupItem.bucket(bucketName));
            }
            expectValidationRejection("invalid_bucket_name_" + suffix,
                    "Invalid bucket name '" + bucketName + "'", created, start);
        });

        String missing = runner.generateUniqueName("nonexistent-bucket");
        Map<String, Supplier<GatewayResult<?>>> operations = new LinkedHashMap<>();
        operations.put("head_bucket", () -> gateway.headBucket(new HeadBucketOperation(missing)));
        operations.put("delete_bucket", () -> gateway.deleteBucket(new DeleteBucketOperation(missing)));
        operations.put("put_object", () -> gateway.putObject(PutObjectOperation.of(missing, "test",
                "data".getBytes(StandardCharsets.UTF_8))));
        operations.put("get_object", () -> gateway.getObject(GetObjectOperation.of(missing, "test")));
        operations.put("list_objects", () -> gateway.listObjectsV2(ListObjectsV2Operation.of(missing, null)));
        operations.forEach((operation, call) -> {
            long start = CategoryRunner.startTimer();
            runner.expectRejection("nonexistent_bucket_" + operation,
                    operation + " on non-existent bucket", call.get(), start, CheckPolicies.NOT_FOUND);
        });
    }

    private void checkInvalidObjectOperations() {
        String bucket = runner.getBucketName();
        INVALID_OBJECT_KEYS.forEach((suffix, key) -> {
            long start = CategoryRunner.startTimer();
            GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.of(bucket, key,
                    "test data".getBytes(StandardCharsets.UTF_8)));
            if (stored.isSuccess()) {
                runner.addCleanupItem(CleanupItem.object(bucket, key));
            }
            expectValidationRejection("invalid_object_key_" + suffix,
                    "Invalid object key (" + describeKey(key) + ")", stored, start);
        });

        String missing = runner.generateUniqueName("nonexistent-object");
        String copyTarget = runner.generateUniqueName("copy-dest");
        Map<String, Supplier<GatewayResult<?>>> operations = new LinkedHashMap<>();
        operations.put("get_object", () -> gateway.getObject(GetObjectOperation.of(bucket, missing)));
        operations.put("head_object", () -> gateway.headObject(new HeadObjectOperation(bucket, missing)));
        operations.put("copy_object", () -> gateway.copyObject(CopyObjectOperation.of(bucket, missing, copyTarget)));
        operations.put("get_object_tagging", () -> gateway.getObjectTagging(new GetObjectTaggingOperation(bucket, missing)));
        operations.forEach((operation, call) -> {
            long start = CategoryRunner.startTimer();
            GatewayResult<?> result = call.get();
            if (result.isSuccess() && "copy_object".equals(operation)) {
                runner.addCleanupItem(CleanupItem.object(bucket, copyTarget));
            }
            runner.expectRejection("nonexistent_object_" + operation,
                    operation + " on non-existent object", result, start, CheckPolicies.NOT_FOUND);
        });

        // Delete is idempotent
        long start = CategoryRunner.startTimer();
        GatewayResult<Void> deleted = gateway.deleteObject(new DeleteObjectOperation(bucket, missing));
        if (deleted.isSuccess()) {
            runner.pass("nonexistent_object_delete_object",
                    "Delete operation on non-existent object succeeded (idempotent behavior)",
                    Details.of("object_key", missing), start);
        } else {
            runner.expectRejection("nonexistent_object_delete_object", "delete_object on non-existent object",
                    deleted, start, CheckPolicies.NOT_FOUND);
        }
    }

    private static String describeKey(String key) {
        if (key.isEmpty()) {
            return "empty";
        }
        if (key.length() > 64) {
            return key.length() + " characters";
        }
        return key.replaceAll("\\p{Cntrl}", "?");
    }

    private void checkMalformedRequests() {
        String bucket = runner.getBucketName();
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> completed = gateway.completeMultipartUpload(new CompleteMultipartUploadOperation(
                bucket, "test-multipart", "invalid-upload-id",
                List.of(UploadedPart.builder().partNumber(1).etag("fake-etag").build())));
        if (completed.isSuccess()) {
            runner.addCleanupItem(CleanupItem.object(bucket, "test-multipart"));
        }
        runner.expectRejection("malformed_complete_multipart", "Completion of an unknown upload",
                completed, start, 400, 404);

        // An empty tag key is not a valid tag set
        start = CategoryRunner.startTimer();
        runner.expectRejection("malformed_bucket_tagging", "Bucket tag set with an empty key",
                gateway.putBucketTagging(new PutBucketTaggingOperation(bucket, Map.of("", "This should fail"))),
                start, 400);

        start = CategoryRunner.startTimer();
        runner.expectRejection("malformed_versioning_config", "Versioning status 'InvalidStatus'",
                gateway.putBucketVersioning(new PutBucketVersioningOperation(bucket, "InvalidStatus")), start, 400);
    }

    /**
     * No policy (404), access denied (403) and no policy support (501) are all acceptable
     */
    private void checkPermissionErrors() {
        long start = CategoryRunner.startTimer();
        GatewayResult<String> policy = gateway.getBucketPolicy(new GetBucketPolicyOperation(runner.getBucketName()));
        if (policy.isSuccess()) {
            runner.pass("bucket_policy_access", "Bucket policy retrieved",
                    Details.of("policy_length", policy.getValue() != null ? policy.getValue().length() : 0), start);
            return;
        }
        GatewayError error = policy.getError();
        Map<String, Object> details = CategoryRunner.errorDetails(error);
        if (error.hasStatus(403, 501)) {
            runner.pass("bucket_policy_access", "Bucket policy access properly restricted or not implemented",
                    details, start);
        } else if (error.isNotFound()) {
            runner.pass("bucket_policy_access", "No bucket policy exists (expected for a new bucket)", details, start);
        } else {
            runner.failWithError("bucket_policy_access", "Unexpected bucket policy error", error, start);
        }
    }

    private void checkResourceNotFound() {
        String bucket = runner.getBucketName();
        String missingBucket = runner.generateUniqueName("missing-bucket");
        Map<String, Supplier<GatewayResult<?>>> resources = new LinkedHashMap<>();
        resources.put("bucket", () -> gateway.headBucket(new HeadBucketOperation(missingBucket)));
        resources.put("object", () -> gateway.getObject(
                GetObjectOperation.of(bucket, runner.generateUniqueName("missing-object"))));
        resources.put("object_metadata", () -> gateway.headObject(
                new HeadObjectOperation(bucket, runner.generateUniqueName("missing-metadata"))));
        resources.put("object_tags", () -> gateway.getObjectTagging(
                new GetObjectTaggingOperation(bucket, runner.generateUniqueName("missing-tags"))));
        resources.forEach((resource, call) -> {
            long start = CategoryRunner.startTimer();
            runner.expectRejection("missing_" + resource + "_404", "Missing " + resource.replace('_', ' '),
                    call.get(), start, CheckPolicies.NOT_FOUND);
        });
    }

    private void checkInvalidParameters() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("param-test-object");
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.of(bucket, key,
                "test data".getBytes(StandardCharsets.UTF_8)));
        if (stored.isFailure()) {
            runner.failWithError("invalid_version_id", "Could not upload object for version test",
                    stored.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.object(bucket, key));

        start = CategoryRunner.startTimer();
        runner.expectRejection("invalid_version_id", "Read with version id 'invalid-version-id-12345'",
                gateway.getObject(GetObjectOperation.builder()
                        .bucketName(bucket)
                        .key(key)
                        .versionId("invalid-version-id-12345")
                        .build()),
                start, 400, 404);
    }

    private void checkSizeLimits() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("large-metadata-test");
        Map<String, String> metadata = new LinkedHashMap<>();
        for (int i = 0; i < 20; i++) {
            metadata.put("key" + i, "x".repeat(1000));
        }
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.builder()
                .bucketName(bucket)
                .key(key)
                .content("test".getBytes(StandardCharsets.UTF_8))
                .metadata(metadata)
                .build());
        if (stored.isSuccess()) {
            runner.addCleanupItem(CleanupItem.object(bucket, key));
        }
        runner.expectRejection("large_metadata_limit", "20 KB of user metadata", stored, start,
                CheckPolicies.TOO_LARGE);
    }

    private void checkConflicts() {
        String bucket = runner.getBucketName();
        long start = CategoryRunner.startTimer();
        GatewayResult<Void> duplicate = gateway.createBucket(new CreateBucketOperation(bucket));
        if (duplicate.isSuccess()) {
            runner.pass("duplicate_bucket_creation", "Duplicate bucket creation succeeded (idempotent behavior)",
                    Details.of("bucket", bucket), start);
        } else if (duplicate.getError().hasCode("BucketAlreadyExists", "BucketAlreadyOwnedByYou")
                || duplicate.failedWith(CheckPolicies.CONFLICT)) {
            runner.pass("duplicate_bucket_creation", "Duplicate bucket creation correctly rejected",
                    CategoryRunner.errorDetails(duplicate.getError()), start);
        } else {
            runner.failWithError("duplicate_bucket_creation", "Unexpected error for duplicate bucket creation",
                    duplicate.getError(), start);
        }

        String key = runner.generateUniqueName("blocking-object");
        GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.of(bucket, key,
                "blocking content".getBytes(StandardCharsets.UTF_8)));
        start = CategoryRunner.startTimer();
        if (stored.isFailure()) {
            runner.failWithError("delete_bucket_with_objects", "Could not upload blocking object",
                    stored.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.object(bucket, key));
        GatewayResult<Void> deleted = gateway.deleteBucket(new DeleteBucketOperation(bucket));
        if (deleted.isFailure() && deleted.getError().hasCode("BucketNotEmpty")) {
            runner.pass("delete_bucket_with_objects", "Non-empty bucket deletion correctly rejected",
                    CategoryRunner.errorDetails(deleted.getError()), start);
        } else {
            runner.expectRejection("delete_bucket_with_objects", "Deletion of a non-empty bucket", deleted, start,
                    CheckPolicies.CONFLICT);
        }
    }

    @Override
    public List<CleanupError> cleanup() {
        return runner.cleanup();
    }

    @Override
    public CategorySummary getSummary() {
        return runner.getSummary();
    }
}
