package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.object.CopyObjectOperation;
import win.ixuni.s3probe.core.operation.object.HeadObjectOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Metadata handling: standard headers, custom x-amz-meta-* fields, encoding, size limits,
 * key case, copy directives, system versus user metadata and edge cases.
 * <p>
 * Preservation probes are scored against the thresholds in {@link CheckPolicies}.
 */
public class MetadataChecks implements CheckCategory {

    public static final String NAME = "metadata";

    static final Instant EXPIRES = Instant.parse("2025-10-21T07:28:00Z");

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final ProbeProperties.TestDataConfig testData;
    private final Logger log;

    public MetadataChecks(CategoryContext context) {
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
        log.info("Starting comprehensive S3 metadata compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("standard_metadata_headers", this::checkStandardHeaders);
        runner.probe("custom_metadata_preservation", this::checkCustomMetadata);
        runner.probe("metadata_encoding_handling", this::checkEncoding);
        runner.probe("metadata_size_limits", this::checkSizeLimits);
        runner.probe("metadata_case_preservation", this::checkCasePreservation);
        runner.probe("metadata_copy_behavior", this::checkCopyBehavior);
        runner.probe("system_user_metadata_distinction", this::checkSystemVersusUser);
        runner.probe("metadata_edge_cases", this::checkEdgeCases);

        log.info("Metadata checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    private byte[] data(int size) {
        return TestDataGenerator.generate(testData.getTestFileContent(), size);
    }

    /**
     * Upload, queue for cleanup and HEAD the result. Records {@code name} as failed and returns null
     * when either call fails.
     */
    private ObjectMetadata putAndHead(String name, PutObjectOperation operation, long start) {
        GatewayResult<StoredObject> stored = gateway.putObject(operation);
        if (stored.isFailure()) {
            runner.failWithError(name, "Upload failed", stored.getError(), start);
            return null;
        }
        runner.addCleanupItem(CleanupItem.object(operation.getBucketName(), operation.getKey()));
        if (stored.getValue().getEtag() == null) {
            runner.fail(name, "Upload failed - no ETag returned", Details.of("object_key", operation.getKey()), start);
            return null;
        }
        return head(name, operation.getKey(), start);
    }

    private ObjectMetadata head(String name, String key, long start) {
        GatewayResult<ObjectMetadata> head = gateway.headObject(new HeadObjectOperation(runner.getBucketName(), key));
        if (head.isFailure()) {
            runner.failWithError(name, "HEAD failed", head.getError(), start);
            return null;
        }
        return head.getValue();
    }

    /**
     * @return keys of {@code expected} whose value {@code actual} returns unchanged
     */
    static <T> List<String> preserved(Map<String, T> expected, Function<String, T> actual) {
        List<String> preserved = new ArrayList<>();
        expected.forEach((field, value) -> {
            if (Objects.equals(value, actual.apply(field))) {
                preserved.add(field);
            }
        });
        return preserved;
    }

    private void recordThreshold(String name, String label, List<String> preserved, int total, double threshold,
                                 Map<String, Object> details, long start) {
        double rate = CheckPolicies.ratio(preserved.size(), total);
        details.put("preserved_fields", preserved);
        details.put("success_rate", rate);
        details.put("threshold", threshold);
        String message = label + ": " + preserved.size() + "/" + total + " preserved correctly";
        if (CheckPolicies.meetsThreshold(preserved.size(), total, threshold)) {
            runner.pass(name, message, details, start);
        } else {
            runner.fail(name, message, details, start);
        }
    }

    private void checkStandardHeaders() {
        String key = runner.generateUniqueName("standard-metadata-test");
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("ContentType", "application/json");
        expected.put("ContentEncoding", "gzip");
        expected.put("ContentDisposition", "attachment; filename=\"test.json\"");
        expected.put("ContentLanguage", "en-US");
        expected.put("CacheControl", "max-age=3600, no-cache");
        expected.put("Expires", EXPIRES);

        long start = CategoryRunner.startTimer();
        ObjectMetadata head = putAndHead("standard_metadata_headers", PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(data(1024))
                .contentType("application/json")
                .contentEncoding("gzip")
                .contentDisposition("attachment; filename=\"test.json\"")
                .contentLanguage("en-US")
                .cacheControl("max-age=3600, no-cache")
                .expires(EXPIRES)
                .build(), start);
        if (head == null) {
            return;
        }
        Map<String, Object> actual = new LinkedHashMap<>();
        actual.put("ContentType", head.getContentType());
        actual.put("ContentEncoding", head.getContentEncoding());
        actual.put("ContentDisposition", head.getContentDisposition());
        actual.put("ContentLanguage", head.getContentLanguage());
        actual.put("CacheControl", head.getCacheControl());
        actual.put("Expires", head.getExpires());
        List<String> preserved = preserved(expected, actual::get);
        for (String header : expected.keySet()) {
            if (!preserved.contains(header)) {
                log.debug("Standard metadata mismatch - {}: expected '{}', got '{}'",
                        header, expected.get(header), actual.get(header));
            }
        }
        recordThreshold("standard_metadata_headers", "Standard metadata headers", preserved, expected.size(),
                CheckPolicies.STANDARD_HEADERS_THRESHOLD, Details.of("object_key", key), start);
    }

    private void checkCustomMetadata() {
        String key = runner.generateUniqueName("custom-metadata-test");
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("author", "S3CompatibilityChecker");
        metadata.put("project", "metadata-testing");
        metadata.put("version", "1.0.0");
        metadata.put("environment", "test");
        metadata.put("numeric-value", "42");
        metadata.put("boolean-value", "true");
        metadata.put("special-chars", "test@example.com");

        long start = CategoryRunner.startTimer();
        ObjectMetadata head = putAndHead("custom_metadata_preservation", PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(data(512))
                .metadata(metadata)
                .contentType("text/plain")
                .build(), start);
        if (head == null) {
            return;
        }
        recordThreshold("custom_metadata_preservation", "Custom metadata",
                preserved(metadata, head.getUserMetadata()::get), metadata.size(),
                CheckPolicies.CUSTOM_METADATA_THRESHOLD,
                Details.of("object_key", key, "returned_metadata", head.getUserMetadata()), start);
    }

    private void checkEncoding() {
        String key = runner.generateUniqueName("encoding-metadata-test");
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("ascii-text", "simple-ascii-value");
        metadata.put("utf8-text", "café-München-日本");
        metadata.put("spaces", "value with spaces");
        metadata.put("url-encoded", URLEncoder.encode("test@example.com", StandardCharsets.UTF_8));
        metadata.put("special-symbols", "!@#$%^&*()");
        metadata.put("numbers", "123456789");
        metadata.put("mixed", "Test_123-Value@2024");

        long start = CategoryRunner.startTimer();
        ObjectMetadata head = putAndHead("metadata_encoding_handling", PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(data(256))
                .metadata(metadata)
                .contentType("application/octet-stream")
                .build(), start);
        if (head == null) {
            return;
        }
        Map<String, String> returned = head.getUserMetadata();
        List<String> outcomes = new ArrayList<>();
        metadata.forEach((field, value) -> {
            String actual = returned.get(field);
            outcomes.add(field + ":" + (value.equals(actual) ? "preserved" : actual != null ? "modified" : "missing"));
        });
        recordThreshold("metadata_encoding_handling", "Metadata encoding", preserved(metadata, returned::get),
                metadata.size(), CheckPolicies.ENCODED_METADATA_THRESHOLD,
                Details.of("object_key", key, "encoding_results", outcomes, "returned_metadata", returned), start);
    }

    /**
     * User metadata is limited to 2 KB; both oversize uploads must be refused
     */
    private void checkSizeLimits() {
        String bucket = runner.getBucketName();
        String largeValueKey = runner.generateUniqueName("large-value-metadata");
        String largeValue = "x".repeat(2048);
        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> large = gateway.putObject(PutObjectOperation.builder()
                .bucketName(bucket)
                .key(largeValueKey)
                .content("test data".getBytes(StandardCharsets.UTF_8))
                .metadata(Map.of("large-field", largeValue))
                .build());
        if (large.isSuccess()) {
            runner.addCleanupItem(CleanupItem.object(bucket, largeValueKey));
        }
        runner.expectRejection("large_metadata_value", "Metadata value of " + largeValue.length() + " bytes",
                large, start, CheckPolicies.TOO_LARGE);

        String manyFieldsKey = runner.generateUniqueName("many-fields-metadata");
        Map<String, String> manyFields = new LinkedHashMap<>();
        for (int i = 0; i < 100; i++) {
            manyFields.put("field" + i, ("value" + i).repeat(50));
        }
        int totalSize = manyFields.entrySet().stream()
                .mapToInt(entry -> entry.getKey().length() + entry.getValue().length())
                .sum();
        start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> many = gateway.putObject(PutObjectOperation.builder()
                .bucketName(bucket)
                .key(manyFieldsKey)
                .content("test data".getBytes(StandardCharsets.UTF_8))
                .metadata(manyFields)
                .build());
        if (many.isSuccess()) {
            runner.addCleanupItem(CleanupItem.object(bucket, manyFieldsKey));
        }
        runner.expectRejection("total_metadata_size_check",
                manyFields.size() + " metadata fields totalling " + totalSize + " bytes", many, start,
                CheckPolicies.TOO_LARGE);
    }

    private void checkCasePreservation() {
        String key = runner.generateUniqueName("case-sensitivity-test");
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("lowercase", "value1");
        metadata.put("UPPERCASE", "value2");
        metadata.put("MixedCase", "value3");
        metadata.put("camelCase", "value4");

        long start = CategoryRunner.startTimer();
        ObjectMetadata head = putAndHead("metadata_case_preservation", PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(data(256))
                .metadata(metadata)
                .build(), start);
        if (head == null) {
            return;
        }
        Map<String, String> returned = head.getUserMetadata();
        Map<String, String> outcomes = new LinkedHashMap<>();
        List<String> exact = new ArrayList<>();
        for (String original : metadata.keySet()) {
            if (returned.containsKey(original)) {
                exact.add(original);
                outcomes.put(original, "exact_match");
            } else {
                outcomes.put(original, returned.keySet().stream()
                        .filter(candidate -> candidate.equalsIgnoreCase(original))
                        .findFirst()
                        .map(candidate -> "case_changed_to_" + candidate)
                        .orElse("missing"));
            }
        }
        long found = outcomes.values().stream().filter(outcome -> !"missing".equals(outcome)).count();
        Map<String, Object> details = Details.of("object_key", key, "case_results", outcomes,
                "returned_metadata", returned, "total_found", found);
        recordThreshold("metadata_case_preservation", "Case sensitivity, keys", exact, metadata.size(),
                CheckPolicies.CASE_PRESERVATION_THRESHOLD, details, start);
    }

    private void checkCopyBehavior() {
        String bucket = runner.getBucketName();
        String sourceKey = runner.generateUniqueName("copy-source-metadata");
        String destinationKey = runner.generateUniqueName("copy-dest-metadata");
        Map<String, String> sourceMetadata = new LinkedHashMap<>();
        sourceMetadata.put("original-author", "source-creator");
        sourceMetadata.put("creation-time", "2024-01-01");
        sourceMetadata.put("category", "original");

        long start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> source = gateway.putObject(PutObjectOperation.builder()
                .bucketName(bucket)
                .key(sourceKey)
                .content(data(512))
                .metadata(sourceMetadata)
                .contentType("text/plain")
                .build());
        if (source.isFailure()) {
            runner.failWithError("metadata_copy_preservation", "Failed to create source object for copy test",
                    source.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.object(bucket, sourceKey));

        start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> copied = gateway.copyObject(CopyObjectOperation.of(bucket, sourceKey, destinationKey));
        if (copied.isFailure()) {
            runner.failWithError("metadata_copy_preservation", "Copy failed", copied.getError(), start);
        } else {
            runner.addCleanupItem(CleanupItem.object(bucket, destinationKey));
            ObjectMetadata head = head("metadata_copy_preservation", destinationKey, start);
            if (head != null) {
                recordThreshold("metadata_copy_preservation", "Copy operation metadata preservation",
                        preserved(sourceMetadata, head.getUserMetadata()::get), sourceMetadata.size(),
                        CheckPolicies.COPY_PRESERVATION_THRESHOLD,
                        Details.of("source_key", sourceKey, "dest_key", destinationKey,
                                "dest_metadata", head.getUserMetadata()), start);
            }
        }

        String replacementKey = runner.generateUniqueName("copy-replacement-metadata");
        Map<String, String> newMetadata = new LinkedHashMap<>();
        newMetadata.put("new-author", "copy-creator");
        newMetadata.put("modified-time", "2024-12-01");
        newMetadata.put("category", "modified");

        start = CategoryRunner.startTimer();
        GatewayResult<StoredObject> replaced = gateway.copyObject(CopyObjectOperation.builder()
                .sourceBucket(bucket)
                .sourceKey(sourceKey)
                .destinationBucket(bucket)
                .destinationKey(replacementKey)
                .metadataDirective(CopyObjectOperation.MetadataDirective.REPLACE)
                .metadata(newMetadata)
                .build());
        if (replaced.isFailure()) {
            runner.failWithError("metadata_copy_replacement", "Copy with metadata replacement failed",
                    replaced.getError(), start);
            return;
        }
        runner.addCleanupItem(CleanupItem.object(bucket, replacementKey));
        ObjectMetadata head = head("metadata_copy_replacement", replacementKey, start);
        if (head == null) {
            return;
        }
        Map<String, String> returned = head.getUserMetadata();
        boolean replacedCorrectly = preserved(newMetadata, returned::get).size() == newMetadata.size();
        // "category" is in both sets and was checked above
        boolean oldAbsent = sourceMetadata.keySet().stream()
                .filter(field -> !newMetadata.containsKey(field))
                .noneMatch(returned::containsKey);
        Map<String, Object> details = Details.of("source_key", sourceKey, "replacement_key", replacementKey,
                "new_metadata", newMetadata, "replace_metadata", returned);
        String message = "Copy with metadata replacement: new metadata set=" + replacedCorrectly
                + ", old metadata removed=" + oldAbsent;
        if (replacedCorrectly && oldAbsent) {
            runner.pass("metadata_copy_replacement", message, details, start);
        } else {
            runner.fail("metadata_copy_replacement", message, details, start);
        }
    }

    private void checkSystemVersusUser() {
        String key = runner.generateUniqueName("system-user-metadata-test");
        Map<String, String> userMetadata = Map.of("user-field", "user-value", "application", "test-app");

        long start = CategoryRunner.startTimer();
        ObjectMetadata head = putAndHead("system_user_metadata_distinction", PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(data(1024))
                .metadata(userMetadata)
                .contentType("application/json")
                .cacheControl("no-cache")
                .contentEncoding("identity")
                .build(), start);
        if (head == null) {
            return;
        }
        List<String> systemPresent = new ArrayList<>();
        if (head.getContentType() != null) {
            systemPresent.add("ContentType");
        }
        if (head.getContentLength() != null) {
            systemPresent.add("ContentLength");
        }
        if (head.getEtag() != null) {
            systemPresent.add("ETag");
        }
        if (head.getLastModified() != null) {
            systemPresent.add("LastModified");
        }
        Map<String, String> returned = head.getUserMetadata();
        boolean userPreserved = preserved(userMetadata, returned::get).size() == userMetadata.size();
        boolean separated = returned.keySet().stream()
                .map(field -> field.toLowerCase(Locale.ROOT))
                .noneMatch(field -> List.of("content-type", "content-length", "etag", "last-modified").contains(field));
        Map<String, Object> details = Details.of("object_key", key, "system_metadata_present", systemPresent,
                "user_metadata_preserved", userPreserved, "metadata_separation", separated,
                "returned_user_metadata", returned);
        String message = "System/User metadata distinction: system fields=" + systemPresent.size()
                + ", user preserved=" + userPreserved + ", separated=" + separated;
        if (userPreserved && systemPresent.size() >= 3 && separated) {
            runner.pass("system_user_metadata_distinction", message, details, start);
        } else {
            runner.fail("system_user_metadata_distinction", message, details, start);
        }
    }

    private void checkEdgeCases() {
        String bucket = runner.getBucketName();
        String emptyKey = runner.generateUniqueName("empty-metadata-test");
        long start = CategoryRunner.startTimer();
        Map<String, String> withEmpty = new LinkedHashMap<>();
        withEmpty.put("empty-field", "");
        withEmpty.put("normal-field", "value");
        ObjectMetadata head = putAndHead("empty_metadata_values", PutObjectOperation.builder()
                .bucketName(bucket)
                .key(emptyKey)
                .content("test".getBytes(StandardCharsets.UTF_8))
                .metadata(withEmpty)
                .build(), start);
        if (head != null) {
            // Dropping the empty field is allowed
            boolean emptyPresent = head.getUserMetadata().containsKey("empty-field");
            boolean normalPreserved = "value".equals(head.getUserMetadata().get("normal-field"));
            Map<String, Object> details = Details.of("object_key", emptyKey, "empty_field_present", emptyPresent,
                    "normal_field_preserved", normalPreserved, "returned_metadata", head.getUserMetadata());
            String message = "Empty metadata values: empty field present=" + emptyPresent
                    + ", normal field preserved=" + normalPreserved;
            if (normalPreserved) {
                runner.pass("empty_metadata_values", message, details, start);
            } else {
                runner.fail("empty_metadata_values", message, details, start);
            }
        }

        String plainKey = runner.generateUniqueName("no-metadata-test");
        start = CategoryRunner.startTimer();
        head = putAndHead("no_metadata_baseline", PutObjectOperation.of(bucket, plainKey,
                "test without metadata".getBytes(StandardCharsets.UTF_8)), start);
        if (head != null) {
            int count = head.getUserMetadata().size();
            Map<String, Object> details = Details.of("object_key", plainKey, "user_metadata_count", count,
                    "user_metadata", head.getUserMetadata());
            if (count == 0) {
                runner.pass("no_metadata_baseline", "No metadata baseline: user metadata count=0", details, start);
            } else {
                runner.fail("no_metadata_baseline", "No metadata baseline: user metadata count=" + count,
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
