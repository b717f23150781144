package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketTaggingOperation;
import win.ixuni.s3probe.core.operation.bucket.GetBucketTaggingOperation;
import win.ixuni.s3probe.core.operation.bucket.PutBucketTaggingOperation;
import win.ixuni.s3probe.core.operation.object.DeleteObjectTaggingOperation;
import win.ixuni.s3probe.core.operation.object.GetObjectTaggingOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectTaggingOperation;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Bucket and object tag sets: put/get round trips, full replacement and deletion
 */
public class TaggingChecks implements CheckCategory {

    public static final String NAME = "tagging";

    static final Map<String, String> BUCKET_TAGS = Map.of(
            "Environment", "Test",
            "Purpose", "S3CompatibilityCheck",
            "Project", "AutomatedTesting");

    static final Map<String, String> OBJECT_TAGS = Map.of(
            "ObjectType", "TestData",
            "Category", "TaggingTest",
            "Temporary", "True");

    static final Map<String, String> UPDATED_OBJECT_TAGS = Map.of(
            "Status", "Updated",
            "Version", "2.0");

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final ProbeProperties.TestDataConfig testData;
    private final Logger log;

    public TaggingChecks(CategoryContext context) {
        this.runner = new CategoryRunner(NAME, context);
        this.gateway = context.getGateway();
        this.testData = context.getTestData();
        this.log = context.getLogger();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CheckResult> runChecks() {
        log.info("Starting tagging compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("bucket_tagging", this::checkBucketTagging);
        runner.probe("object_tagging", this::checkObjectTagging);

        log.info("Tagging checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    private void checkBucketTagging() {
        String bucket = runner.getBucketName();
        long start = CategoryRunner.startTimer();
        GatewayResult<Void> put = gateway.putBucketTagging(new PutBucketTaggingOperation(bucket, BUCKET_TAGS));
        if (put.isFailure()) {
            runner.failWithError("bucket_tagging_put_get", "Failed to set bucket tags", put.getError(), start);
            return;
        }
        compareTags("bucket_tagging_put_get", "bucket", BUCKET_TAGS,
                gateway.getBucketTagging(new GetBucketTaggingOperation(bucket)), start);

        start = CategoryRunner.startTimer();
        GatewayResult<Void> deleted = gateway.deleteBucketTagging(new DeleteBucketTaggingOperation(bucket));
        if (deleted.isFailure()) {
            runner.failWithError("bucket_tagging_delete", "Failed to delete bucket tags", deleted.getError(), start);
            return;
        }
        verifyNoTags("bucket_tagging_delete", "bucket",
                () -> gateway.getBucketTagging(new GetBucketTaggingOperation(bucket)), start);
    }

    private void checkObjectTagging() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("tagging-test-object");
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.of(bucket, key,
                TestDataGenerator.generate(testData.getTestFileContent(), testData.getSmallFileSize())));
        if (stored.isFailure()) {
            runner.failWithError("object_tagging_put_get", "Could not upload object to tag", stored.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.object(bucket, key));

        GatewayResult<Void> put = gateway.putObjectTagging(new PutObjectTaggingOperation(bucket, key, OBJECT_TAGS));
        if (put.isFailure()) {
            runner.failWithError("object_tagging_put_get", "Failed to set object tags", put.getError(), start);
        } else {
            compareTags("object_tagging_put_get", "object", OBJECT_TAGS,
                    gateway.getObjectTagging(new GetObjectTaggingOperation(bucket, key)), start);
        }

        // A put replaces the whole tag set
        start = CategoryRunner.startTimer();
        GatewayResult<Void> updated = gateway.putObjectTagging(
                new PutObjectTaggingOperation(bucket, key, UPDATED_OBJECT_TAGS));
        if (updated.isFailure()) {
            runner.failWithError("object_tagging_update", "Failed to update object tags", updated.getError(), start);
        } else {
            compareTags("object_tagging_update", "updated object", UPDATED_OBJECT_TAGS,
                    gateway.getObjectTagging(new GetObjectTaggingOperation(bucket, key)), start);
        }

        start = CategoryRunner.startTimer();
        GatewayResult<Void> deleted = gateway.deleteObjectTagging(new DeleteObjectTaggingOperation(bucket, key));
        if (deleted.isFailure()) {
            runner.failWithError("object_tagging_delete", "Failed to delete object tags", deleted.getError(), start);
            return;
        }
        verifyNoTags("object_tagging_delete", "object",
                () -> gateway.getObjectTagging(new GetObjectTaggingOperation(bucket, key)), start);
    }

    private void compareTags(String name, String subject, Map<String, String> expected,
                             GatewayResult<Map<String, String>> returned, long start) {
        if (returned.isFailure()) {
            runner.failWithError(name, "Failed to read " + subject + " tags", returned.getError(), start);
            return;
        }
        Map<String, String> actual = returned.getValue();
        if (actual.size() != expected.size()) {
            runner.fail(name, "Expected " + expected.size() + " " + subject + " tags, got " + actual.size(),
                    Details.of("expected", expected, "actual", actual), start);
        } else if (!expected.equals(actual)) {
            runner.fail(name, "Tag values don't match: expected " + expected + ", got " + actual,
                    Details.of("expected", expected, "actual", actual), start);
        } else {
            runner.pass(name, "Successfully set and retrieved " + subject + " tags",
                    Details.of("tags", actual), start);
        }
    }

    /**
     * An empty tag set and a 404 both mean the tags are gone
     */
    private void verifyNoTags(String name, String subject, Supplier<GatewayResult<Map<String, String>>> read,
                              long start) {
        GatewayResult<Map<String, String>> remaining = read.get();
        if (remaining.isSuccess() && remaining.getValue().isEmpty()) {
            runner.pass(name, "Successfully deleted " + subject + " tags", Map.of(), start);
        } else if (remaining.isSuccess()) {
            runner.fail(name, subject + " tags still exist after deletion: " + remaining.getValue(),
                    Details.of("remaining_tags", remaining.getValue()), start);
        } else if (remaining.failedWith(404)) {
            runner.pass(name, "Successfully deleted " + subject + " tags (404 response)",
                    CategoryRunner.errorDetails(remaining.getError()), start);
        } else {
            runner.failWithError(name, "Unexpected error verifying " + subject + " tag deletion",
                    remaining.getError(), start);
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
