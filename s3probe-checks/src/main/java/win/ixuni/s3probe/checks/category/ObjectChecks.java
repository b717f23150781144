package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.*;
import win.ixuni.s3probe.core.operation.object.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Object checks: upload, download, HEAD, copy, listing, tagging and deletion
 */
public class ObjectChecks implements CheckCategory {

    public static final String NAME = "objects";

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final ProbeProperties.TestDataConfig testData;
    private final Logger log;

    public ObjectChecks(CategoryContext context) {
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
        log.info("Starting object compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("object_upload", this::checkObjectUpload);
        runner.probe("object_download", this::checkObjectDownload);
        runner.probe("object_head_operation", this::checkObjectHead);
        runner.probe("object_copy", this::checkObjectCopy);
        runner.probe("object_listing", this::checkObjectListing);
        runner.probe("object_tagging", this::checkObjectTagging);
        runner.probe("object_deletion", this::checkObjectDeletion);

        log.info("Object checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    private byte[] data(int size) {
        return TestDataGenerator.generate(testData.getTestFileContent(), size);
    }

    /**
     * Upload and queue for cleanup on success
     */
    private GatewayResult<StoredObject> put(PutObjectOperation operation) {
        GatewayResult<StoredObject> result = gateway.putObject(operation);
        if (result.isSuccess()) {
            runner.addCleanupItem(CleanupItem.object(operation.getBucketName(), operation.getKey()));
        }
        return result;
    }

    private void checkObjectUpload() {
        String bucket = runner.getBucketName();
        uploadAndExpectEtag("object_upload_small", "small", testData.getSmallFileSize());
        uploadAndExpectEtag("object_upload_medium", "medium", testData.getMediumFileSize());

        Map<String, String> metadata = Map.of(
                "author", "S3CompatibilityChecker",
                "test-type", "object-upload",
                "custom-field", "test-value");
        String key = runner.generateUniqueName("metadata-object");
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> stored = put(PutObjectOperation.builder()
                .bucketName(bucket)
                .key(key)
                .content(data(testData.getSmallFileSize()))
                .metadata(metadata)
                .contentType("text/plain")
                .build());
        if (stored.isFailure()) {
            runner.failWithError("object_upload_with_metadata", "Failed to upload object with metadata",
                    stored.getError(), start);
        } else if (stored.getValue().getEtag() == null) {
            runner.fail("object_upload_with_metadata", "Metadata upload response missing ETag",
                    Details.of("object_key", key), start);
        } else {
            runner.pass("object_upload_with_metadata", "Successfully uploaded object with metadata",
                    Details.of("object_key", key, "metadata", metadata, "etag", stored.getValue().getEtag()), start);
        }
    }

    private void uploadAndExpectEtag(String resultName, String label, int size) {
        String key = runner.generateUniqueName(label + "-object");
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> stored = put(PutObjectOperation.of(runner.getBucketName(), key, data(size)));
        if (stored.isFailure()) {
            runner.failWithError(resultName, "Failed to upload " + label + " object", stored.getError(), start);
        } else if (stored.getValue().getEtag() == null) {
            runner.fail(resultName, "Upload response missing ETag", Details.of("object_key", key), start);
        } else {
            runner.pass(resultName, "Successfully uploaded " + label + " object (" + size + " bytes)",
                    Details.of("object_key", key, "size", size, "etag", stored.getValue().getEtag()), start);
        }
    }

    private void checkObjectDownload() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("download-test-object");
        byte[] expected = data(2048);
        GatewayResult<StoredObject> stored = put(PutObjectOperation.of(bucket, key, expected));
        long start = CategoryRunner.startTimer();
        if (stored.isFailure()) {
            runner.failWithError("object_download", "Could not upload object to download", stored.getError(), start);
        } else {
            GatewayResult<ObjectContent> downloaded = gateway.getObject(GetObjectOperation.of(bucket, key));
            if (downloaded.isFailure()) {
                runner.failWithError("object_download", "Failed to download object", downloaded.getError(), start);
            } else if (Arrays.equals(expected, downloaded.getValue().getData())) {
                runner.pass("object_download", "Downloaded content matches the upload byte for byte",
                        Details.of("object_key", key, "size", expected.length), start);
            } else {
                runner.fail("object_download", "Downloaded content differs from the upload",
                        Details.of("object_key", key, "expected_size", expected.length,
                                "actual_size", downloaded.getValue().length()), start);
            }
        }

        String missing = runner.generateUniqueName("nonexistent-object");
        start = CategoryRunner.startTimer();
        runner.expectRejection("object_download_nonexistent", "Download of non-existent object",
                gateway.getObject(GetObjectOperation.of(bucket, missing)), start, CheckPolicies.NOT_FOUND);
    }

    private void checkObjectHead() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("head-test-object");
        byte[] content = data(1024);
        GatewayResult<StoredObject> stored = put(PutObjectOperation.builder()
                .bucketName(bucket)
                .key(key)
                .content(content)
                .metadata(Map.of("test-field", "head-operation-test"))
                .contentType("application/json")
                .build());
        long start = CategoryRunner.startTimer();
        if (stored.isFailure()) {
            runner.failWithError("object_head_operation", "Could not upload object for HEAD", stored.getError(), start);
            return;
        }
        GatewayResult<ObjectMetadata> head = gateway.headObject(new HeadObjectOperation(bucket, key));
        if (head.isFailure()) {
            runner.failWithError("object_head_operation", "HEAD on uploaded object failed", head.getError(), start);
            return;
        }

        ObjectMetadata metadata = head.getValue();
        List<String> passed = new ArrayList<>();
        if (metadata.getContentLength() != null && metadata.getContentLength() == content.length) {
            passed.add("content_length_correct");
        }
        if (metadata.getEtag() != null && metadata.getEtag().equals(stored.getValue().getEtag())) {
            passed.add("etag_matches");
        }
        if (metadata.getContentType() != null) {
            passed.add("content_type_present");
        }
        if ("head-operation-test".equals(metadata.getUserMetadata().get("test-field"))) {
            passed.add("metadata_preserved");
        }

        Map<String, Object> details = Details.of("object_key", key, "passed_checks", passed,
                "content_length", metadata.getContentLength(), "etag", metadata.getEtag());
        if (passed.size() >= 3) {
            runner.pass("object_head_operation",
                    "Head operation returned correct metadata (" + passed.size() + "/4 checks passed)", details, start);
        } else {
            runner.fail("object_head_operation",
                    "Head operation failed validation (" + passed.size() + "/4 checks passed)", details, start);
        }
    }

    private void checkObjectCopy() {
        String bucket = runner.getBucketName();
        String source = runner.generateUniqueName("copy-source-object");
        String destination = runner.generateUniqueName("copy-dest-object");
        byte[] content = data(1024);
        GatewayResult<StoredObject> stored = put(PutObjectOperation.builder()
                .bucketName(bucket)
                .key(source)
                .content(content)
                .contentType("text/plain")
                .build());
        long start = CategoryRunner.startTimer();
        if (stored.isFailure()) {
            runner.failWithError("object_copy", "Could not upload copy source", stored.getError(), start);
            return;
        }
        GatewayResult<StoredObject> copied = gateway.copyObject(CopyObjectOperation.of(bucket, source, destination));
        if (copied.isFailure()) {
            runner.failWithError("object_copy", "Failed to copy object", copied.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.object(bucket, destination));
        if (copied.getValue().getEtag() == null) {
            runner.fail("object_copy", "Copy response missing ETag", Details.of("destination", destination), start);
            return;
        }
        GatewayResult<ObjectContent> downloaded = gateway.getObject(GetObjectOperation.of(bucket, destination));
        if (downloaded.isSuccess() && Arrays.equals(content, downloaded.getValue().getData())) {
            runner.pass("object_copy", "Successfully copied object with identical content",
                    Details.of("source", source, "destination", destination,
                            "source_etag", stored.getValue().getEtag(), "copy_etag", copied.getValue().getEtag()),
                    start);
        } else {
            runner.fail("object_copy", "Copied object content does not match the source",
                    Details.of("source", source, "destination", destination,
                            "download", downloaded.isSuccess() ? "content differs" : downloaded.getError().describe()),
                    start);
        }
    }

    private void checkObjectListing() {
        String bucket = runner.getBucketName();
        String prefix = runner.generateUniqueName("list-test");
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String key = prefix + "-object-" + i;
            GatewayResult<StoredObject> stored = put(PutObjectOperation.of(bucket, key,
                    TestDataGenerator.generate("Test object " + i, 512)));
            if (stored.isFailure()) {
                runner.failWithError("object_listing_v2", "Could not upload listing fixture " + key,
                        stored.getError(), CategoryRunner.startTimer());
                return;
            }
            keys.add(key);
        }

        long start = CategoryRunner.startTimer();
        verifyListing("object_listing_v2", "v2",
                gateway.listObjectsV2(ListObjectsV2Operation.of(bucket, prefix)), keys, start);

        start = CategoryRunner.startTimer();
        verifyListing("object_listing_v1", "v1",
                gateway.listObjects(ListObjectsOperation.builder().bucketName(bucket).prefix(prefix).build()),
                keys, start);
    }

    private void verifyListing(String resultName, String api, GatewayResult<ListObjectsResult> listing,
                               List<String> expected, long start) {
        if (listing.isFailure()) {
            runner.failWithError(resultName, "Failed to list objects with " + api + " API", listing.getError(), start);
            return;
        }
        List<String> listed = listing.getValue().keys();
        long found = expected.stream().filter(listed::contains).count();
        if (found == expected.size()) {
            runner.pass(resultName, "Successfully listed all " + expected.size() + " objects with " + api + " API",
                    Details.of("expected_count", expected.size(), "found_count", found), start);
        } else {
            runner.fail(resultName, "Listed " + found + " objects, expected " + expected.size(),
                    Details.of("expected_keys", expected, "listed_keys", listed), start);
        }
    }

    private void checkObjectTagging() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("metadata-test-object");
        GatewayResult<StoredObject> stored = put(PutObjectOperation.of(bucket, key, data(2048)));
        long start = CategoryRunner.startTimer();
        if (stored.isFailure()) {
            runner.failWithError("object_tagging", "Could not upload object to tag", stored.getError(), start);
            return;
        }
        Map<String, String> tags = Map.of("Environment", "Test", "ObjectType", "MetadataTest");
        GatewayResult<Void> tagged = gateway.putObjectTagging(new PutObjectTaggingOperation(bucket, key, tags));
        if (tagged.isFailure()) {
            runner.failWithError("object_tagging", "Failed to set object tags", tagged.getError(), start);
            return;
        }
        GatewayResult<Map<String, String>> returned = gateway.getObjectTagging(new GetObjectTaggingOperation(bucket, key));
        if (returned.isFailure()) {
            runner.failWithError("object_tagging", "Failed to read object tags", returned.getError(), start);
        } else if (tags.equals(returned.getValue())) {
            runner.pass("object_tagging", "Successfully set and retrieved object tags",
                    Details.of("object_key", key, "tags", returned.getValue()), start);
        } else {
            runner.fail("object_tagging", "Object tags do not match",
                    Details.of("expected", tags, "actual", returned.getValue()), start);
        }
    }

    private void checkObjectDeletion() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("delete-test-object");
        GatewayResult<StoredObject> stored = put(PutObjectOperation.of(bucket, key, data(1024)));
        long start = CategoryRunner.startTimer();
        if (stored.isFailure()) {
            runner.failWithError("object_deletion", "Could not upload object to delete", stored.getError(), start);
        } else {
            GatewayResult<Void> deleted = gateway.deleteObject(new DeleteObjectOperation(bucket, key));
            if (deleted.isFailure()) {
                runner.failWithError("object_deletion", "Failed to delete object", deleted.getError(), start);
            } else {
                runner.forgetCleanupItem(CleanupItem.object(bucket, key));
                GatewayResult<ObjectMetadata> head = gateway.headObject(new HeadObjectOperation(bucket, key));
                if (head.failedWith(404)) {
                    runner.pass("object_deletion", "Successfully deleted object", Details.of("object_key", key), start);
                } else if (head.isSuccess()) {
                    runner.fail("object_deletion", "Object still exists after deletion",
                            Details.of("object_key", key), start);
                } else {
                    runner.failWithError("object_deletion", "Unexpected error verifying deletion",
                            head.getError(), start);
                }
            }
        }

        // Deletes are idempotent: success or 404 both pass
        String missing = runner.generateUniqueName("nonexistent-delete-object");
        start = CategoryRunner.startTimer();
        GatewayResult<Void> deleted = gateway.deleteObject(new DeleteObjectOperation(bucket, missing));
        if (deleted.isSuccess()) {
            runner.pass("object_deletion_nonexistent",
                    "Delete operation on non-existent object succeeded (idempotent behavior)",
                    Details.of("object_key", missing), start);
        } else if (deleted.failedWith(404)) {
            runner.pass("object_deletion_nonexistent",
                    "Delete operation on non-existent object returned 404 (acceptable behavior)",
                    CategoryRunner.errorDetails(deleted.getError()), start);
        } else {
            runner.failWithError("object_deletion_nonexistent", "Unexpected error deleting non-existent object",
                    deleted.getError(), start);
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
