package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.model.ObjectContent;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.object.GetObjectOperation;
import win.ixuni.s3probe.core.operation.object.ListObjectsV2Operation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Access patterns of sync tools: batch uploads and downloads, a directory tree under one prefix,
 * prefix listing and paginated listing.
 */
public class SyncChecks implements CheckCategory {

    public static final String NAME = "sync";

    static final List<String> DIRECTORY_TREE = List.of(
            "docs/readme.txt",
            "docs/api/overview.txt",
            "docs/api/reference.txt",
            "src/main.py",
            "src/utils/helper.py",
            "src/utils/config.py",
            "tests/test_main.py",
            "tests/integration/test_api.py");

    static final int BATCH_SIZE = 5;

    static final int PAGE_SIZE = 2;

    /**
     * Bound on pages followed by the pagination probe
     */
    private static final int MAX_PAGES = 100;

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final Logger log;

    private String directoryPrefix;

    public SyncChecks(CategoryContext context) {
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
        log.info("Starting sync compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("sync_batch_upload", this::checkBatchUpload);
        runner.probe("sync_directory_structure", this::checkDirectoryStructure);
        runner.probe("sync_batch_download", this::checkBatchDownload);
        runner.probe("sync_listing_prefix", this::checkPrefixListing);
        runner.probe("sync_listing_pagination", this::checkPagination);

        log.info("Sync checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    /**
     * @return true when the object was stored and queued for cleanup
     */
    private boolean upload(String key, byte[] data, String contentType) {
        GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(data)
                .contentType(contentType)
                .build());
        if (stored.isFailure()) {
            log.debug("Failed to upload {}: {}", key, stored.getError().describe());
            return false;
        }
        runner.addCleanupItem(CleanupItem.object(runner.getBucketName(), key));
        return stored.getValue().getEtag() != null;
    }

    private void checkBatchUpload() {
        long start = CategoryRunner.startTimer();
        int uploaded = 0;
        for (int i = 0; i < BATCH_SIZE; i++) {
            byte[] data = ("Batch upload test data for object " + i + "\n").repeat(10).getBytes(StandardCharsets.UTF_8);
            if (upload(runner.generateUniqueName("batch-upload-" + i), data, null)) {
                uploaded++;
            }
        }
        double duration = CategoryRunner.secondsSince(start);
        Map<String, Object> details = Details.of("objects_count", BATCH_SIZE, "successful_uploads", uploaded,
                "average_duration", duration / BATCH_SIZE);
        if (uploaded == BATCH_SIZE) {
            runner.pass("sync_batch_upload", "Successfully uploaded " + uploaded + " objects in batch",
                    details, duration);
        } else if (uploaded > 0) {
            runner.fail("sync_batch_upload", "Partial batch upload success: " + uploaded + "/" + BATCH_SIZE
                    + " objects uploaded", details, duration);
        } else {
            runner.fail("sync_batch_upload", "Batch upload completely failed: 0/" + BATCH_SIZE + " objects uploaded",
                    details, duration);
        }
    }

    /**
     * Every file of the tree goes under one prefix, which the listing probe then reads back
     */
    private void checkDirectoryStructure() {
        String root = runner.generateUniqueName("dir-sync") + "/";
        long start = CategoryRunner.startTimer();
        int uploaded = 0;
        for (String path : DIRECTORY_TREE) {
            byte[] data = ("Content of " + path + "\nGenerated for sync testing\n").getBytes(StandardCharsets.UTF_8);
            if (upload(root + path, data, "text/plain")) {
                uploaded++;
            }
        }
        Map<String, Object> details = Details.of("prefix", root, "files_count", DIRECTORY_TREE.size(),
                "successful_uploads", uploaded);
        if (uploaded == DIRECTORY_TREE.size()) {
            directoryPrefix = root;
            runner.pass("sync_directory_structure",
                    "Successfully uploaded directory structure (" + uploaded + " files)", details, start);
        } else {
            runner.fail("sync_directory_structure", "Directory structure upload failed: " + uploaded + "/"
                    + DIRECTORY_TREE.size() + " files", details, start);
        }
    }

    private void checkBatchDownload() {
        Map<String, byte[]> expected = new LinkedHashMap<>();
        for (int i = 0; i < 3; i++) {
            String key = runner.generateUniqueName("download-test-" + i);
            byte[] data = TestDataGenerator.repeat("Download test content for object " + i + "\n",
                    ("Download test content for object " + i + "\n").length() * 50);
            if (upload(key, data, null)) {
                expected.put(key, data);
            }
        }
        long start = CategoryRunner.startTimer();
        if (expected.isEmpty()) {
            runner.fail("sync_batch_download", "No objects available for batch download test", Map.of(), start);
            return;
        }

        int downloaded = 0;
        int matches = 0;
        for (Map.Entry<String, byte[]> entry : expected.entrySet()) {
            GatewayResult<ObjectContent> content = gateway.getObject(
                    GetObjectOperation.of(runner.getBucketName(), entry.getKey()));
            if (content.isFailure()) {
                log.debug("Failed to download {}: {}", entry.getKey(), content.getError().describe());
                continue;
            }
            downloaded++;
            if (Arrays.equals(entry.getValue(), content.getValue().getData())) {
                matches++;
            }
        }
        Map<String, Object> details = Details.of("objects_count", expected.size(),
                "successful_downloads", downloaded, "data_matches", matches);
        if (downloaded == expected.size() && matches == expected.size()) {
            runner.pass("sync_batch_download", "Successfully downloaded and verified " + downloaded + " objects",
                    details, start);
        } else {
            runner.fail("sync_batch_download", "Batch download issues: " + downloaded + "/" + expected.size()
                    + " downloaded, " + matches + "/" + expected.size() + " data matches", details, start);
        }
    }

    private void checkPrefixListing() {
        long start = CategoryRunner.startTimer();
        if (directoryPrefix == null) {
            runner.fail("sync_listing_prefix", "No directory structure available for listing patterns test",
                    Map.of(), start);
            return;
        }
        GatewayResult<ListObjectsResult> listing = gateway.listObjectsV2(
                ListObjectsV2Operation.of(runner.getBucketName(), directoryPrefix));
        if (listing.isFailure()) {
            runner.failWithError("sync_listing_prefix", "Failed to list objects by prefix", listing.getError(), start);
            return;
        }
        List<String> expected = DIRECTORY_TREE.stream().map(path -> directoryPrefix + path).toList();
        List<String> listed = listing.getValue().keys();
        long outside = listed.stream().filter(key -> !key.startsWith(directoryPrefix)).count();
        Map<String, Object> details = Details.of("prefix", directoryPrefix, "expected_count", expected.size(),
                "objects_found", listed.size(), "outside_prefix", outside);
        if (listed.containsAll(expected) && outside == 0) {
            runner.pass("sync_listing_prefix", "Successfully listed " + listed.size() + " objects with prefix",
                    details, start);
        } else {
            details.put("listed_keys", listed);
            runner.fail("sync_listing_prefix", "Prefix listing returned " + listed.size() + " objects, expected "
                    + expected.size(), details, start);
        }
    }

    /**
     * Pages of two keys must walk the whole bucket exactly once
     */
    private void checkPagination() {
        long start = CategoryRunner.startTimer();
        String bucket = runner.getBucketName();
        GatewayResult<ListObjectsResult> full = gateway.listObjectsV2(ListObjectsV2Operation.of(bucket, null));
        if (full.isFailure()) {
            runner.failWithError("sync_listing_pagination", "Failed to list objects", full.getError(), start);
            return;
        }
        List<String> all = full.getValue().keys();

        List<String> walked = new ArrayList<>();
        List<Integer> pageSizes = new ArrayList<>();
        String token = null;
        boolean firstTruncated = false;
        for (int page = 0; page < MAX_PAGES; page++) {
            GatewayResult<ListObjectsResult> listing = gateway.listObjectsV2(ListObjectsV2Operation.builder()
                    .bucketName(bucket)
                    .maxKeys(PAGE_SIZE)
                    .continuationToken(token)
                    .build());
            if (listing.isFailure()) {
                runner.failWithError("sync_listing_pagination", "Pagination failed on page " + (page + 1),
                        listing.getError(), start);
                return;
            }
            ListObjectsResult result = listing.getValue();
            if (page == 0) {
                firstTruncated = result.isTruncated();
            }
            pageSizes.add(result.getObjects().size());
            walked.addAll(result.keys());
            token = result.getNextToken();
            if (!result.isTruncated() || token == null) {
                break;
            }
        }

        Set<String> distinct = new LinkedHashSet<>(walked);
        boolean pagesBounded = pageSizes.stream().allMatch(size -> size <= PAGE_SIZE);
        boolean complete = distinct.size() == walked.size() && distinct.containsAll(all) && all.containsAll(distinct);
        Map<String, Object> details = Details.of("max_keys", PAGE_SIZE, "objects_total", all.size(),
                "objects_walked", walked.size(), "pages", pageSizes.size(), "page_sizes", pageSizes,
                "is_truncated", firstTruncated);
        if (pagesBounded && complete && (all.size() <= PAGE_SIZE || firstTruncated)) {
            runner.pass("sync_listing_pagination", "Successfully paginated " + walked.size() + " objects in "
                    + pageSizes.size() + " pages", details, start);
        } else {
            details.put("pages_bounded", pagesBounded);
            details.put("complete", complete);
            runner.fail("sync_listing_pagination", "Paginated listing inconsistent: " + walked.size() + "/"
                    + all.size() + " objects walked", details, start);
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
