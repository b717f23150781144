package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.ObjectContent;
import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.object.GetObjectOperation;
import win.ixuni.s3probe.core.operation.object.HeadObjectOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Partial object retrieval with the Range header: single bytes, closed ranges, suffixes, multiple
 * ranges, invalid headers and If-Range.
 * <p>
 * All probes read one 10,000 byte object of numbered 100 byte lines.
 */
public class RangeRequestChecks implements CheckCategory {

    public static final String NAME = "range_requests";

    static final String NON_MATCHING_ETAG = "fake-etag-12345";

    /**
     * Invalid range headers, keyed by result name suffix
     */
    static final Map<String, String> INVALID_RANGES = Details.cases(
            "non_numeric", "bytes=abc-def",
            "end_before_start", "bytes=100-50",
            "beyond_size", "bytes=999999-999999",
            "end_beyond_size", "bytes=0-999999",
            "malformed_header", "invalid-range-header",
            "empty", "bytes=",
            "empty_suffix", "bytes=-");

    static final Map<String, String> MULTI_RANGES = Details.cases(
            "two_chunks", "bytes=0-99,200-299",
            "three_chunks", "bytes=0-49,100-149,200-249",
            "head_and_tail", "bytes=0-9,-10");

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final Logger log;

    private final byte[] testData = TestDataGenerator.rangeTestData();
    private String objectKey;

    public RangeRequestChecks(CategoryContext context) {
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
        log.info("Starting range request compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("range_test_object_upload", this::uploadTestObject);
        if (objectKey == null) {
            return runner.getResults();
        }
        runner.probe("range_single_byte", this::checkSingleBytes);
        runner.probe("range_partial", this::checkPartialRanges);
        runner.probe("range_suffix", this::checkSuffixRanges);
        runner.probe("range_multi", this::checkMultipleRanges);
        runner.probe("range_invalid", this::checkInvalidRanges);
        runner.probe("range_with_etag", this::checkIfRange);

        log.info("Range request checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    private void uploadTestObject() {
        String key = runner.generateUniqueName("range-test-object");
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(testData)
                .contentType("application/octet-stream")
                .build());
        if (stored.isFailure()) {
            runner.failWithError("range_test_object_upload", "Failed to upload test object for range operations",
                    stored.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.object(runner.getBucketName(), key));
        objectKey = key;
        log.info("Uploaded test object: {} ({} bytes)", key, testData.length);
    }

    private GatewayResult<ObjectContent> get(String range) {
        return gateway.getObject(GetObjectOperation.range(runner.getBucketName(), objectKey, range));
    }

    private byte[] slice(long first, long last) {
        return Arrays.copyOfRange(testData, (int) first, (int) last + 1);
    }

    private void checkSingleBytes() {
        int last = testData.length - 1;
        singleByte("first_byte", "First byte", "bytes=0-0", 0);
        singleByte("100th_byte", "100th byte", "bytes=99-99", 99);
        singleByte("middle_byte", "Middle byte", "bytes=500-500", 500);
        singleByte("last_byte", "Last byte", "bytes=-1", last);
    }

    /**
     * Five sub-checks, at least three must hold
     */
    private void singleByte(String suffix, String description, String range, int offset) {
        String name = "range_single_byte_" + suffix;
        long start = CategoryRunner.startTimer();
        GatewayResult<ObjectContent> result = get(range);
        if (result.isFailure()) {
            runner.failWithError(name, "Failed single byte range request for " + description, result.getError(), start);
            return;
        }
        ObjectContent content = result.getValue();
        byte[] expected = slice(offset, offset);
        List<String> checks = new ArrayList<>();
        if (content.getStatusCode() == 206) {
            checks.add("status_206");
        }
        String contentRange = content.getContentRange();
        if (contentRange != null && !contentRange.isEmpty()) {
            checks.add("content_range_header");
            if (contentRange.contains("bytes " + offset + "-" + offset + "/")) {
                checks.add("content_range_correct");
            }
        }
        if (Arrays.equals(expected, content.getData())) {
            checks.add("data_matches");
        }
        ObjectMetadata metadata = content.getMetadata();
        if (metadata != null && metadata.getContentLength() != null && metadata.getContentLength() == expected.length) {
            checks.add("content_length_correct");
        }
        Map<String, Object> details = Details.of("range_header", range, "expected_size", expected.length,
                "actual_size", content.length(), "content_range", contentRange, "passed_checks", checks);
        if (checks.size() >= 3) {
            runner.pass(name, "Successfully retrieved " + description + " using range request", details, start);
        } else {
            runner.fail(name, "Range request for " + description + " failed validation (" + checks.size()
                    + "/5 checks)", details, start);
        }
    }

    private void checkPartialRanges() {
        int size = testData.length;
        long[][] cases = {{0, 99}, {100, 299}, {1000, 1999}, {5000, 7499}, {size - 100, size - 1}};
        for (long[] bounds : cases) {
            verifyExactRange("range_partial_" + bounds[0] + "_" + bounds[1],
                    "bytes=" + bounds[0] + "-" + bounds[1], bounds[0], bounds[1]);
        }
    }

    private void checkSuffixRanges() {
        int size = testData.length;
        for (int suffix : new int[]{1, 10, 100, 1000, size}) {
            verifyExactRange("range_suffix_" + suffix, "bytes=-" + suffix, Math.max(0, size - suffix), size - 1);
        }
    }

    /**
     * Pass iff 206 with exactly bytes {@code first..last}
     */
    private void verifyExactRange(String name, String range, long first, long last) {
        long start = CategoryRunner.startTimer();
        GatewayResult<ObjectContent> result = get(range);
        if (result.isFailure()) {
            runner.failWithError(name, "Failed range request " + range, result.getError(), start);
            return;
        }
        ObjectContent content = result.getValue();
        byte[] expected = slice(first, last);
        boolean matches = Arrays.equals(expected, content.getData());
        Map<String, Object> details = Details.of("range_header", range, "expected_size", expected.length,
                "actual_size", content.length(), "data_matches", matches, "status_code", content.getStatusCode(),
                "content_range", content.getContentRange());
        if (matches && content.getStatusCode() == 206) {
            runner.pass(name, "Successfully retrieved " + range + " (" + expected.length + " bytes)", details, start);
        } else {
            runner.fail(name, "Range request validation failed for " + range, details, start);
        }
    }

    /**
     * Multipart, a single 206 range, the full object or a 400/501 refusal are all acceptable
     */
    private void checkMultipleRanges() {
        MULTI_RANGES.forEach((suffix, range) -> {
            String name = "range_multi_" + suffix;
            long start = CategoryRunner.startTimer();
            GatewayResult<ObjectContent> result = get(range);
            if (result.isFailure()) {
                if (result.failedWith(CheckPolicies.NOT_SUPPORTED)) {
                    Map<String, Object> details = CategoryRunner.errorDetails(result.getError());
                    details.put("range_header", range);
                    details.put("note", "Multiple ranges not supported (acceptable)");
                    runner.pass(name, "Multiple range request rejected as not supported: " + range, details, start);
                } else {
                    runner.failWithError(name, "Multiple range request failed unexpectedly: " + range,
                            result.getError(), start);
                }
                return;
            }
            ObjectContent content = result.getValue();
            String contentType = content.getMetadata() != null ? content.getMetadata().getContentType() : null;
            Map<String, Object> details = Details.of("range_header", range, "content_type", contentType,
                    "response_size", content.length(), "status_code", content.getStatusCode());
            if (contentType != null && contentType.contains("multipart/byteranges")) {
                runner.pass(name, "Multiple ranges returned as multipart response", details, start);
            } else if (content.getStatusCode() == 206) {
                details.put("note", "Single range returned instead of multipart");
                runner.pass(name, "Multiple range request returned single range (acceptable)", details, start);
            } else if (content.getStatusCode() == 200 && Arrays.equals(testData, content.getData())) {
                details.put("note", "Range header ignored, full object returned");
                runner.pass(name, "Multiple range request returned full object (acceptable)", details, start);
            } else {
                runner.fail(name, "Multiple range request returned unexpected response", details, start);
            }
        });
    }

    /**
     * A 200 (header ignored) or a 400/416 rejection pass. A 206 fails, except for an end offset
     * past the object that was clamped to the whole object.
     */
    private void checkInvalidRanges() {
        INVALID_RANGES.forEach((suffix, range) -> {
            String name = "range_invalid_" + suffix;
            long start = CategoryRunner.startTimer();
            GatewayResult<ObjectContent> result = get(range);
            if (result.isFailure()) {
                Map<String, Object> details = CategoryRunner.errorDetails(result.getError());
                details.put("range_header", range);
                if (result.failedWith(400, 416)) {
                    runner.pass(name, "Invalid range correctly rejected: " + range, details, start);
                } else {
                    runner.fail(name, "Invalid range request returned unexpected error: " + range
                            + " - " + result.getError().describe(), details, start);
                }
                return;
            }
            ObjectContent content = result.getValue();
            Map<String, Object> details = Details.of("range_header", range, "status_code", content.getStatusCode(),
                    "content_range", content.getContentRange());
            if (content.getStatusCode() == 200) {
                details.put("note", "Invalid range ignored (acceptable behavior)");
                runner.pass(name, "Invalid range ignored, full object returned: " + range, details, start);
            } else if (content.getStatusCode() == 206 && "end_beyond_size".equals(suffix)
                    && Arrays.equals(testData, content.getData())) {
                details.put("note", "End offset clamped to the object size");
                runner.pass(name, "Range end beyond object size clamped to the whole object", details, start);
            } else if (content.getStatusCode() == 206) {
                runner.fail(name, "Invalid range request returned partial content: " + range, details, start);
            } else {
                runner.fail(name, "Invalid range request succeeded unexpectedly: " + range, details, start);
            }
        });
    }

    private void checkIfRange() {
        long start = CategoryRunner.startTimer();
        GatewayResult<ObjectMetadata> head = gateway.headObject(new HeadObjectOperation(runner.getBucketName(), objectKey));
        if (head.isFailure() || head.getValue().getEtag() == null) {
            runner.fail("range_with_etag", "Could not retrieve ETag for range condition testing",
                    head.isFailure() ? CategoryRunner.errorDetails(head.getError()) : Map.of(), start);
            return;
        }
        String etag = head.getValue().getEtag();

        start = CategoryRunner.startTimer();
        GatewayResult<ObjectContent> matching = gateway.getObject(GetObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(objectKey)
                .range("bytes=0-99")
                .ifRange(etag)
                .build());
        if (matching.isFailure()) {
            runner.failWithError("range_with_matching_etag", "Range request with matching ETag failed",
                    matching.getError(), start);
        } else {
            Map<String, Object> details = Details.of("range_header", "bytes=0-99", "etag", etag,
                    "status_code", matching.getValue().getStatusCode());
            if (matching.getValue().getStatusCode() == 206) {
                runner.pass("range_with_matching_etag", "Range request with matching ETag succeeded", details, start);
            } else {
                runner.fail("range_with_matching_etag", "Range request with matching ETag returned unexpected status",
                        details, start);
            }
        }

        // A stale validator must not yield a partial response
        start = CategoryRunner.startTimer();
        GatewayResult<ObjectContent> stale = gateway.getObject(GetObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(objectKey)
                .range("bytes=0-99")
                .ifRange(NON_MATCHING_ETAG)
                .build());
        if (stale.isFailure()) {
            runner.pass("range_with_nonmatching_etag", "Range request with non-matching ETag rejected",
                    CategoryRunner.errorDetails(stale.getError()), start);
        } else {
            Map<String, Object> details = Details.of("range_header", "bytes=0-99", "etag", NON_MATCHING_ETAG,
                    "status_code", stale.getValue().getStatusCode());
            if (stale.getValue().getStatusCode() == 200) {
                runner.pass("range_with_nonmatching_etag", "Non-matching ETag returned full object", details, start);
            } else {
                runner.fail("range_with_nonmatching_etag", "Non-matching ETag still returned partial content",
                        details, start);
            }
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
