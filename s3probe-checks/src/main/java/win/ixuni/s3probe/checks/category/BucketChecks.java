package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.BucketInfo;
import win.ixuni.s3probe.core.operation.bucket.*;

import java.util.List;
import java.util.Map;

/**
 * Bucket lifecycle checks: creation and naming rules, listing, HEAD, versioning, tagging and deletion.
 * <p>
 * Creation and deletion are exercised on secondary buckets created inline; the scoped bucket is
 * used for the configuration probes.
 */
public class BucketChecks implements CheckCategory {

    public static final String NAME = "buckets";

    static final String INVALID_BUCKET_NAME = "Invalid_Bucket_Name_With_Underscores_And_Capitals";

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final Logger log;

    public BucketChecks(CategoryContext context) {
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
        log.info("Starting bucket compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("bucket_creation", this::checkBucketCreation);
        runner.probe("bucket_creation_invalid_name", this::checkInvalidBucketName);
        runner.probe("bucket_listing", this::checkBucketListing);
        runner.probe("bucket_head", this::checkBucketHead);
        runner.probe("bucket_versioning", this::checkBucketVersioning);
        runner.probe("bucket_tagging", this::checkBucketTagging);
        runner.probe("bucket_deletion", this::checkBucketDeletion);

        log.info("Bucket checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    private void checkBucketCreation() {
        String name = runner.generateUniqueName("test-bucket");
        long start = CategoryRunner.startTimer();
        GatewayResult<Void> created = gateway.createBucket(new CreateBucketOperation(name));
        if (created.isFailure()) {
            runner.failWithError("bucket_creation", "Failed to create bucket " + name, created.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.bucket(name));
        runner.pass("bucket_creation", "Successfully created bucket '" + name + "'",
                Details.of("bucket_name", name), start);
    }

    private void checkInvalidBucketName() {
        long start = CategoryRunner.startTimer();
        GatewayResult<Void> created = gateway.createBucket(new CreateBucketOperation(INVALID_BUCKET_NAME));
        if (created.isSuccess()) {
            runner.addCleanupItem(CleanupItem.bucket(INVALID_BUCKET_NAME));
        }
        runner.expectRejection("bucket_creation_invalid_name",
                "Bucket name with underscores and capitals", created, start, CheckPolicies.VALIDATION_ERROR);
    }

    private void checkBucketListing() {
        long start = CategoryRunner.startTimer();
        GatewayResult<List<BucketInfo>> listed = gateway.listBuckets(new ListBucketsOperation());
        if (listed.isFailure()) {
            runner.failWithError("bucket_listing", "Failed to list buckets", listed.getError(), start);
            return;
        }
        List<BucketInfo> buckets = listed.getValue();
        List<String> names = buckets.stream().map(BucketInfo::getName).toList();
        if (!names.contains(runner.getBucketName())) {
            runner.fail("bucket_listing", "Bucket listing does not contain the test bucket",
                    Details.of("bucket_count", buckets.size(), "expected", runner.getBucketName()), start);
        } else {
            runner.pass("bucket_listing", "Successfully listed " + buckets.size() + " buckets",
                    Details.of("bucket_count", buckets.size()), start);
        }

        BucketInfo invalid = buckets.stream()
                .filter(bucket -> bucket.getName() == null || bucket.getCreationDate() == null)
                .findFirst()
                .orElse(null);
        if (invalid != null) {
            runner.fail("bucket_listing_structure", "Bucket entry is missing Name or CreationDate",
                    Details.of("invalid_bucket", invalid.getName()), start);
        } else {
            runner.pass("bucket_listing_structure", "Bucket entries carry Name and CreationDate",
                    Details.of("sample_bucket", buckets.isEmpty() ? null : buckets.get(0).getName()), start);
        }
    }

    private void checkBucketHead() {
        String bucket = runner.getBucketName();
        long start = CategoryRunner.startTimer();
        GatewayResult<Void> head = gateway.headBucket(new HeadBucketOperation(bucket));
        if (head.isSuccess()) {
            runner.pass("bucket_head_existing", "HEAD on existing bucket succeeded",
                    Details.of("bucket_name", bucket), start);
        } else {
            runner.failWithError("bucket_head_existing", "HEAD on existing bucket failed", head.getError(), start);
        }

        String missing = runner.generateUniqueName("nonexistent-bucket");
        start = CategoryRunner.startTimer();
        runner.expectRejection("bucket_head_nonexistent", "HEAD on non-existent bucket",
                gateway.headBucket(new HeadBucketOperation(missing)), start, CheckPolicies.NOT_FOUND);
    }

    private void checkBucketVersioning() {
        String bucket = runner.getBucketName();
        long start = CategoryRunner.startTimer();
        GatewayResult<String> status = gateway.getBucketVersioning(new GetBucketVersioningOperation(bucket));
        if (status.isFailure()) {
            runner.failWithError("bucket_versioning_default", "Failed to read versioning status",
                    status.getError(), start);
            return;
        }
        String value = status.getValue();
        if (value == null || value.isEmpty() || "Disabled".equals(value)) {
            runner.pass("bucket_versioning_default", "Bucket versioning correctly disabled by default",
                    Details.of("status", value), start);
        } else {
            runner.fail("bucket_versioning_default", "Unexpected default versioning status: " + value,
                    Details.of("status", value), start);
        }

        start = CategoryRunner.startTimer();
        GatewayResult<Void> enabled = gateway.putBucketVersioning(new PutBucketVersioningOperation(bucket, "Enabled"));
        if (enabled.isFailure()) {
            runner.failWithError("bucket_versioning_enable", "Failed to enable versioning", enabled.getError(), start);
            return;
        }
        GatewayResult<String> after = gateway.getBucketVersioning(new GetBucketVersioningOperation(bucket));
        if (after.isSuccess() && "Enabled".equals(after.getValue())) {
            runner.pass("bucket_versioning_enable", "Successfully enabled bucket versioning",
                    Details.of("bucket_name", bucket), start);
        } else {
            runner.fail("bucket_versioning_enable", "Versioning status not Enabled after enabling it",
                    Details.of("status", after.isSuccess() ? after.getValue() : after.getError().describe()), start);
        }
    }

    private void checkBucketTagging() {
        String bucket = runner.getBucketName();
        Map<String, String> tags = Map.of("Environment", "Test", "Project", "S3Compatibility");

        long start = CategoryRunner.startTimer();
        GatewayResult<Void> put = gateway.putBucketTagging(new PutBucketTaggingOperation(bucket, tags));
        if (put.isFailure()) {
            if (put.getError().hasStatus(CheckPolicies.NOT_SUPPORTED)) {
                runner.pass("bucket_tagging_put_get", "Bucket tagging not supported (acceptable)",
                        Details.of("note", "Optional feature", "error_code", put.getError().getCode()), start);
            } else {
                runner.failWithError("bucket_tagging_put_get", "Failed to set bucket tags", put.getError(), start);
            }
            return;
        }
        GatewayResult<Map<String, String>> got = gateway.getBucketTagging(new GetBucketTaggingOperation(bucket));
        if (got.isFailure()) {
            runner.failWithError("bucket_tagging_put_get", "Failed to read bucket tags", got.getError(), start);
            return;
        }
        if (tags.equals(got.getValue())) {
            runner.pass("bucket_tagging_put_get", "Bucket tags stored and returned correctly",
                    Details.of("tags", got.getValue()), start);
        } else {
            runner.fail("bucket_tagging_put_get", "Returned bucket tags differ from the stored ones",
                    Details.of("expected", tags, "actual", got.getValue()), start);
        }

        start = CategoryRunner.startTimer();
        GatewayResult<Void> deleted = gateway.deleteBucketTagging(new DeleteBucketTaggingOperation(bucket));
        if (deleted.isFailure()) {
            runner.failWithError("bucket_tagging_delete", "Failed to delete bucket tags", deleted.getError(), start);
            return;
        }
        GatewayResult<Map<String, String>> remaining = gateway.getBucketTagging(new GetBucketTaggingOperation(bucket));
        // NoSuchTagSet (404) and an empty set both mean the tags are gone
        if ((remaining.isSuccess() && remaining.getValue().isEmpty()) || remaining.failedWith(404)) {
            runner.pass("bucket_tagging_delete", "Bucket tags deleted", Details.of("bucket_name", bucket), start);
        } else {
            runner.fail("bucket_tagging_delete", "Bucket tags still present after deletion",
                    Details.of("remaining", remaining.isSuccess() ? remaining.getValue() : remaining.getError().describe()),
                    start);
        }
    }

    private void checkBucketDeletion() {
        String name = runner.generateUniqueName("delete-test-bucket");
        GatewayResult<Void> created = gateway.createBucket(new CreateBucketOperation(name));
        if (created.isFailure()) {
            runner.failWithError("bucket_deletion_empty", "Could not create bucket to delete",
                    created.getError(), CategoryRunner.startTimer());
        } else {
            CleanupItem item = CleanupItem.bucket(name);
            runner.addCleanupItem(item);
            long start = CategoryRunner.startTimer();
            GatewayResult<Void> deleted = gateway.deleteBucket(new DeleteBucketOperation(name));
            if (deleted.isSuccess()) {
                runner.forgetCleanupItem(item);
                runner.pass("bucket_deletion_empty", "Successfully deleted empty bucket '" + name + "'",
                        Details.of("bucket_name", name), start);
            } else {
                runner.failWithError("bucket_deletion_empty", "Failed to delete empty bucket",
                        deleted.getError(), start);
            }
        }

        String missing = runner.generateUniqueName("nonexistent-delete-bucket");
        long start = CategoryRunner.startTimer();
        runner.expectRejection("bucket_deletion_nonexistent", "Delete of non-existent bucket",
                gateway.deleteBucket(new DeleteBucketOperation(missing)), start, CheckPolicies.NOT_FOUND);
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
