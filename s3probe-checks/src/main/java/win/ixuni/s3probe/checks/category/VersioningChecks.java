package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.ObjectContent;
import win.ixuni.s3probe.core.model.ObjectVersion;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.bucket.GetBucketVersioningOperation;
import win.ixuni.s3probe.core.operation.bucket.PutBucketVersioningOperation;
import win.ixuni.s3probe.core.operation.object.DeleteObjectOperation;
import win.ixuni.s3probe.core.operation.object.GetObjectOperation;
import win.ixuni.s3probe.core.operation.object.ListObjectVersionsOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Object versioning: default status, enabling, multiple versions of one key, version listing,
 * reads by version id and deletion of a single version.
 */
public class VersioningChecks implements CheckCategory {

    public static final String NAME = "versioning";

    static final int VERSION_COUNT = 3;

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final Logger log;

    private String versionedKey;
    private final List<CreatedVersion> versions = new ArrayList<>();

    public VersioningChecks(CategoryContext context) {
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
        log.info("Starting versioning compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("versioning_configuration", this::checkConfiguration);
        runner.probe("versioning_create_versions", this::checkMultipleVersions);
        runner.probe("versioning_list_versions", this::checkVersionListing);
        runner.probe("versioning_get_version", this::checkVersionReads);
        runner.probe("versioning_delete_version", this::checkVersionDeletion);

        log.info("Versioning checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    private void checkConfiguration() {
        String bucket = runner.getBucketName();
        long start = CategoryRunner.startTimer();
        GatewayResult<String> status = gateway.getBucketVersioning(new GetBucketVersioningOperation(bucket));
        if (status.isFailure()) {
            runner.failWithError("versioning_default_disabled", "Failed to read default versioning status",
                    status.getError(), start);
        } else if (status.getValue() == null || status.getValue().isEmpty() || "Disabled".equals(status.getValue())) {
            runner.pass("versioning_default_disabled", "Bucket versioning correctly disabled by default",
                    Details.of("status", status.getValue()), start);
        } else {
            runner.fail("versioning_default_disabled", "Unexpected default versioning status: " + status.getValue(),
                    Details.of("status", status.getValue()), start);
        }

        start = CategoryRunner.startTimer();
        GatewayResult<Void> enabled = gateway.putBucketVersioning(new PutBucketVersioningOperation(bucket, "Enabled"));
        if (enabled.isFailure()) {
            runner.failWithError("versioning_enable", "Failed to enable versioning", enabled.getError(), start);
            return;
        }
        GatewayResult<String> after = gateway.getBucketVersioning(new GetBucketVersioningOperation(bucket));
        if (after.isSuccess() && "Enabled".equals(after.getValue())) {
            runner.pass("versioning_enable", "Successfully enabled bucket versioning",
                    Details.of("status", after.getValue()), start);
        } else {
            runner.fail("versioning_enable", "Failed to enable versioning, status: "
                            + (after.isSuccess() ? after.getValue() : after.getError().describe()),
                    Details.of("bucket", bucket), start);
        }
    }

    private void checkMultipleVersions() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("versioned-object");
        List<CreatedVersion> created = new ArrayList<>();
        boolean unversionedWrite = false;
        for (int number = 1; number <= VERSION_COUNT; number++) {
            String name = "versioning_create_version_" + number;
            String content = "Version " + number + " content - test data";
            long start = CategoryRunner.startTimer();
            GatewayResult<StoredObject> stored = gateway.putObject(
                    PutObjectOperation.of(bucket, key, content.getBytes(StandardCharsets.UTF_8)));
            if (stored.isFailure()) {
                runner.failWithError(name, "Failed to create version " + number, stored.getError(), start);
                continue;
            }
            String versionId = stored.getValue().getVersionId();
            if (versionId == null || "null".equals(versionId)) {
                unversionedWrite = true;
                runner.fail(name, "Version " + number + " creation response missing VersionId",
                        Details.of("object_key", key, "version_id", versionId), start);
                continue;
            }
            runner.addCleanupItem(CleanupItem.objectVersion(bucket, key, versionId));
            created.add(new CreatedVersion(number, versionId, content));
            runner.pass(name, "Successfully created version " + number,
                    Details.of("object_key", key, "version_id", versionId), start);
        }
        if (unversionedWrite) {
            // Unversioned overwrites, the object itself still needs deleting
            runner.addCleanupItem(CleanupItem.object(bucket, key));
        }
        if (created.size() == VERSION_COUNT) {
            versionedKey = key;
            versions.addAll(created);
        }
    }

    private void checkVersionListing() {
        long start = CategoryRunner.startTimer();
        if (versionedKey == null) {
            runner.fail("versioning_list_versions", "No versioned object available for listing test", Map.of(), start);
            return;
        }
        GatewayResult<List<ObjectVersion>> listed = gateway.listObjectVersions(
                new ListObjectVersionsOperation(runner.getBucketName(), null));
        if (listed.isFailure()) {
            runner.failWithError("versioning_list_versions", "Failed to list object versions", listed.getError(), start);
            return;
        }
        Set<String> actual = listed.getValue().stream()
                .filter(version -> versionedKey.equals(version.getKey()) && !version.isDeleteMarker())
                .map(ObjectVersion::getVersionId)
                .collect(Collectors.toSet());
        Set<String> expected = versions.stream().map(CreatedVersion::versionId).collect(Collectors.toSet());
        Map<String, Object> details = Details.of("object_key", versionedKey,
                "expected_version_ids", expected, "actual_version_ids", actual);
        if (actual.size() != expected.size()) {
            runner.fail("versioning_list_versions",
                    "Expected " + expected.size() + " versions, found " + actual.size(), details, start);
        } else if (!expected.equals(actual)) {
            runner.fail("versioning_list_versions", "Version IDs don't match expected values", details, start);
        } else {
            runner.pass("versioning_list_versions", "Successfully listed " + actual.size() + " versions",
                    details, start);
        }
    }

    private void checkVersionReads() {
        if (versionedKey == null) {
            runner.fail("versioning_get_version", "No versioned object available for version-specific tests",
                    Map.of(), 0.0);
            return;
        }
        for (CreatedVersion version : versions) {
            String name = "versioning_get_version_" + version.number();
            long start = CategoryRunner.startTimer();
            GatewayResult<ObjectContent> read = gateway.getObject(GetObjectOperation.builder()
                    .bucketName(runner.getBucketName())
                    .key(versionedKey)
                    .versionId(version.versionId())
                    .build());
            if (read.isFailure()) {
                runner.failWithError(name, "Failed to get version " + version.number(), read.getError(), start);
                continue;
            }
            String actual = TestDataGenerator.utf8(read.getValue().getData());
            Map<String, Object> details = Details.of("object_key", versionedKey, "version_id", version.versionId());
            if (version.content().equals(actual)) {
                runner.pass(name, "Successfully retrieved version " + version.number() + " content", details, start);
            } else {
                details.put("expected_content", version.content());
                details.put("actual_content", actual);
                runner.fail(name, "Version " + version.number() + " content doesn't match expected", details, start);
            }
        }
    }

    private void checkVersionDeletion() {
        long start = CategoryRunner.startTimer();
        if (versionedKey == null) {
            runner.fail("versioning_delete_version", "No versioned object available for version deletion test",
                    Map.of(), start);
            return;
        }
        String bucket = runner.getBucketName();
        CreatedVersion oldest = versions.get(0);
        GatewayResult<Void> deleted = gateway.deleteObject(
                new DeleteObjectOperation(bucket, versionedKey, oldest.versionId()));
        if (deleted.isFailure()) {
            runner.failWithError("versioning_delete_version", "Failed to delete version", deleted.getError(), start);
            return;
        }
        runner.forgetCleanupItem(CleanupItem.objectVersion(bucket, versionedKey, oldest.versionId()));
        Map<String, Object> details = Details.of("object_key", versionedKey, "version_id", oldest.versionId());
        runner.pass("versioning_delete_version", "Successfully deleted version " + oldest.number(), details, start);

        start = CategoryRunner.startTimer();
        GatewayResult<ObjectContent> read = gateway.getObject(GetObjectOperation.builder()
                .bucketName(bucket)
                .key(versionedKey)
                .versionId(oldest.versionId())
                .build());
        if (read.isSuccess()) {
            runner.fail("versioning_delete_verification", "Deleted version still accessible", details, start);
        } else if (read.failedWith(404)) {
            runner.pass("versioning_delete_verification", "Deleted version correctly not found (404)", details, start);
        } else {
            runner.failWithError("versioning_delete_verification", "Unexpected error accessing deleted version",
                    read.getError(), start);
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

    private record CreatedVersion(int number, String versionId, String content) {
    }
}
