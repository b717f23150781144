package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.model.ObjectAttribute;
import win.ixuni.s3probe.core.model.ObjectAttributes;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.multipart.CompleteMultipartUploadOperation;
import win.ixuni.s3probe.core.operation.multipart.CreateMultipartUploadOperation;
import win.ixuni.s3probe.core.operation.multipart.UploadPartOperation;
import win.ixuni.s3probe.core.operation.object.GetObjectAttributesOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * GetObjectAttributes: ETag, size and storage class, several attributes at once, and part
 * information of a multipart object.
 * <p>
 * The attribute API returns the ETag without quotes, so ETags are compared unquoted.
 */
public class AttributesChecks implements CheckCategory {

    public static final String NAME = "attributes";

    static final int MULTIPART_PART_COUNT = 2;

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final ProbeProperties.TestDataConfig testData;
    private final Logger log;

    private StoredObject small;
    private StoredObject medium;

    public AttributesChecks(CategoryContext context) {
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
        log.info("Starting object attributes compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("attributes_setup", this::uploadTestObjects);
        runner.probe("attributes_etag", this::checkEtag);
        runner.probe("attributes_size_and_storage", this::checkSizeAndStorage);
        runner.probe("attributes_multiple", this::checkMultiple);
        runner.probe("attributes_multipart_parts", this::checkMultipartParts);

        log.info("Attributes checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    static String unquote(String etag) {
        if (etag != null && etag.length() >= 2 && etag.startsWith("\"") && etag.endsWith("\"")) {
            return etag.substring(1, etag.length() - 1);
        }
        return etag;
    }

    private GatewayResult<ObjectAttributes> attributes(String key, ObjectAttribute first, ObjectAttribute... rest) {
        return gateway.getObjectAttributes(
                new GetObjectAttributesOperation(runner.getBucketName(), key, EnumSet.of(first, rest)));
    }

    /**
     * Fixture uploads are not results of their own; a failed upload surfaces in the dependent probes
     */
    private void uploadTestObjects() {
        small = upload("attributes-small-object", testData.getSmallFileSize(), Map.of());
        medium = upload("attributes-medium-object", testData.getMediumFileSize(),
                Map.of("test-field", "attributes-test", "object-type", "medium"));
    }

    private StoredObject upload(String prefix, int size, Map<String, String> metadata) {
        String key = runner.generateUniqueName(prefix);
        GatewayResult<StoredObject> stored = gateway.putObject(PutObjectOperation.builder()
                .bucketName(runner.getBucketName())
                .key(key)
                .content(TestDataGenerator.generate(testData.getTestFileContent(), size))
                .metadata(metadata)
                .build());
        if (stored.isFailure()) {
            log.warn("Could not upload attributes fixture {}: {}", key, stored.getError().describe());
            return null;
        }
        runner.addCleanupItem(CleanupItem.object(runner.getBucketName(), key));
        StoredObject object = stored.getValue();
        if (object.getSize() == null) {
            object.setSize((long) size);
        }
        object.setKey(key);
        return object;
    }

    private void checkEtag() {
        long start = CategoryRunner.startTimer();
        if (small == null) {
            runner.fail("attributes_etag", "Small test object not available", Map.of(), start);
            return;
        }
        GatewayResult<ObjectAttributes> result = attributes(small.getKey(), ObjectAttribute.ETAG);
        if (result.isFailure()) {
            runner.failWithError("attributes_etag", "Failed to get ETag attribute", result.getError(), start);
            return;
        }
        String expected = unquote(small.getEtag());
        String returned = unquote(result.getValue().getEtag());
        Map<String, Object> details = Details.of("object_key", small.getKey(),
                "expected_etag", expected, "returned_etag", returned);
        if (returned == null) {
            runner.fail("attributes_etag", "ETag attribute not returned", details, start);
        } else if (returned.equals(expected)) {
            runner.pass("attributes_etag", "Successfully retrieved correct ETag attribute", details, start);
        } else {
            runner.fail("attributes_etag",
                    "ETag attribute doesn't match: expected " + expected + ", got " + returned, details, start);
        }
    }

    private void checkSizeAndStorage() {
        long start = CategoryRunner.startTimer();
        if (medium == null) {
            runner.fail("attributes_size_and_storage", "Medium test object not available", Map.of(), start);
            return;
        }
        GatewayResult<ObjectAttributes> result = attributes(medium.getKey(),
                ObjectAttribute.OBJECT_SIZE, ObjectAttribute.STORAGE_CLASS);
        if (result.isFailure()) {
            runner.failWithError("attributes_size_and_storage", "Failed to get size attributes",
                    result.getError(), start);
            return;
        }
        ObjectAttributes attributes = result.getValue();
        Map<String, Object> details = Details.of("object_key", medium.getKey(),
                "expected_size", medium.getSize(), "object_size", attributes.getObjectSize(),
                "storage_class", attributes.getStorageClass() != null ? attributes.getStorageClass() : "not_provided");
        // Storage class is optional
        if (medium.getSize().equals(attributes.getObjectSize())) {
            runner.pass("attributes_size_and_storage", "Successfully retrieved size attributes", details, start);
        } else if (attributes.getObjectSize() == null) {
            runner.fail("attributes_size_and_storage", "ObjectSize attribute not returned", details, start);
        } else {
            runner.fail("attributes_size_and_storage", "Object size mismatch: expected " + medium.getSize()
                    + ", got " + attributes.getObjectSize(), details, start);
        }
    }

    private void checkMultiple() {
        long start = CategoryRunner.startTimer();
        if (small == null) {
            runner.fail("attributes_multiple", "Small test object not available", Map.of(), start);
            return;
        }
        GatewayResult<ObjectAttributes> result = attributes(small.getKey(),
                ObjectAttribute.ETAG, ObjectAttribute.OBJECT_SIZE, ObjectAttribute.STORAGE_CLASS);
        if (result.isFailure()) {
            runner.failWithError("attributes_multiple", "Failed to get multiple attributes", result.getError(), start);
            return;
        }
        ObjectAttributes attributes = result.getValue();
        List<String> returned = new ArrayList<>();
        if (attributes.getEtag() != null) {
            returned.add("ETag");
        }
        if (attributes.getObjectSize() != null) {
            returned.add("ObjectSize");
        }
        if (attributes.getStorageClass() != null) {
            returned.add("StorageClass");
        }
        Map<String, Object> details = Details.of("object_key", small.getKey(),
                "requested_attributes", List.of("ETag", "ObjectSize", "StorageClass"), "returned_attributes", returned);
        // ETag and ObjectSize at minimum
        if (returned.size() >= 2) {
            runner.pass("attributes_multiple", "Retrieved " + returned.size() + "/3 requested attributes",
                    details, start);
        } else {
            runner.fail("attributes_multiple", "Only " + returned.size() + "/3 requested attributes returned",
                    details, start);
        }
    }

    private void checkMultipartParts() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("multipart-attr-object");
        int chunkSize = testData.getMultipartChunkSize();
        long start = CategoryRunner.startTimer();

        GatewayResult<MultipartUpload> created = gateway.createMultipartUpload(
                new CreateMultipartUploadOperation(bucket, key));
        if (created.isFailure()) {
            runner.failWithError("attributes_multipart_setup", "Failed to create multipart object",
                    created.getError(), start);
            return;
        }
        String uploadId = created.getValue().getUploadId();
        runner.addCleanupItem(CleanupItem.multipartUpload(bucket, key, uploadId));

        List<UploadedPart> parts = new ArrayList<>();
        for (int partNumber = 1; partNumber <= MULTIPART_PART_COUNT; partNumber++) {
            byte[] data = TestDataGenerator.repeat("Multipart test data part " + partNumber + " ", chunkSize);
            GatewayResult<UploadedPart> uploaded = gateway.uploadPart(
                    new UploadPartOperation(bucket, key, uploadId, partNumber, data));
            if (uploaded.isFailure()) {
                runner.failWithError("attributes_multipart_setup", "Failed to upload part " + partNumber,
                        uploaded.getError(), start);
                return;
            }
            parts.add(UploadedPart.builder().partNumber(partNumber).etag(uploaded.getValue().getEtag()).build());
        }
        GatewayResult<StoredObject> completed = gateway.completeMultipartUpload(
                new CompleteMultipartUploadOperation(bucket, key, uploadId, parts));
        if (completed.isFailure()) {
            runner.failWithError("attributes_multipart_setup", "Failed to complete multipart object",
                    completed.getError(), start);
            return;
        }
        runner.forgetCleanupItem(CleanupItem.multipartUpload(bucket, key, uploadId));
        runner.addCleanupItem(CleanupItem.object(bucket, key));

        start = CategoryRunner.startTimer();
        GatewayResult<ObjectAttributes> result = attributes(key, ObjectAttribute.OBJECT_PARTS);
        if (result.isFailure()) {
            if (result.failedWith(CheckPolicies.NOT_SUPPORTED)) {
                runner.pass("attributes_multipart_parts", "ObjectParts attribute not supported (acceptable)",
                        CategoryRunner.errorDetails(result.getError()), start);
            } else {
                runner.failWithError("attributes_multipart_parts", "Failed to get multipart attributes",
                        result.getError(), start);
            }
            return;
        }
        ObjectAttributes attributes = result.getValue();
        int listed = attributes.getParts() != null ? attributes.getParts().size() : 0;
        Integer total = attributes.getTotalPartsCount();
        Map<String, Object> details = Details.of("object_key", key, "expected_parts", MULTIPART_PART_COUNT,
                "listed_parts", listed, "total_parts_count", total);
        if (listed == MULTIPART_PART_COUNT || (total != null && total == MULTIPART_PART_COUNT)) {
            runner.pass("attributes_multipart_parts", "Successfully retrieved multipart parts attribute",
                    details, start);
        } else if (attributes.getParts() == null && total == null) {
            runner.fail("attributes_multipart_parts", "ObjectParts attribute not returned", details, start);
        } else {
            runner.fail("attributes_multipart_parts", "Expected " + MULTIPART_PART_COUNT + " parts, got "
                    + (total != null ? total : listed), details, start);
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
