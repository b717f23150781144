package win.ixuni.s3probe.checks.category;

import org.slf4j.Logger;
import win.ixuni.s3probe.checks.support.Details;
import win.ixuni.s3probe.checks.support.TestDataGenerator;
import win.ixuni.s3probe.core.check.*;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.multipart.*;
import win.ixuni.s3probe.core.operation.object.HeadObjectOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Multipart upload workflow: create, upload parts, list parts, complete, abort, list uploads.
 * <p>
 * Part listing and completion reuse the upload built by the part upload probe.
 */
public class MultipartChecks implements CheckCategory {

    public static final String NAME = "multipart";

    static final int PART_COUNT = 3;

    private final CategoryRunner runner;
    private final StorageGateway gateway;
    private final int chunkSize;
    private final Logger log;

    /**
     * Upload left open by the part upload probe, null when it could not be built
     */
    private PendingUpload pending;

    public MultipartChecks(CategoryContext context) {
        this.runner = new CategoryRunner(NAME, context);
        this.gateway = context.getGateway();
        this.chunkSize = context.getTestData().getMultipartChunkSize();
        this.log = context.getLogger();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CheckResult> runChecks() {
        log.info("Starting multipart upload compatibility checks...");
        if (!runner.provisionBucket()) {
            return runner.getResults();
        }

        runner.probe("multipart_upload_creation", this::checkCreation);
        runner.probe("multipart_part_upload", this::checkPartUpload);
        runner.probe("multipart_list_parts", this::checkListParts);
        runner.probe("multipart_completion", this::checkCompletion);
        runner.probe("multipart_abort", this::checkAbort);
        runner.probe("multipart_list_uploads", this::checkListUploads);

        log.info("Multipart upload checks completed: {} checks performed", runner.getResults().size());
        return runner.getResults();
    }

    static byte[] partData(int partNumber, int size) {
        return TestDataGenerator.repeat("Multipart upload test data - Part " + partNumber + "\n", size);
    }

    private GatewayResult<MultipartUpload> create(String key, String contentType) {
        GatewayResult<MultipartUpload> created = gateway.createMultipartUpload(
                new CreateMultipartUploadOperation(runner.getBucketName(), key, contentType, Map.of()));
        if (created.isSuccess()) {
            runner.addCleanupItem(CleanupItem.multipartUpload(runner.getBucketName(), key,
                    created.getValue().getUploadId()));
        }
        return created;
    }

    private void checkCreation() {
        String key = runner.generateUniqueName("multipart-creation-test");
        long start = CategoryRunner.startTimer();
        GatewayResult<MultipartUpload> created = create(key, "application/octet-stream");
        if (created.isFailure()) {
            runner.failWithError("multipart_upload_creation", "Failed to create multipart upload",
                    created.getError(), start);
        } else if (created.getValue().getUploadId() == null) {
            runner.fail("multipart_upload_creation", "Multipart upload response missing UploadId",
                    Details.of("object_key", key), start);
        } else {
            runner.pass("multipart_upload_creation", "Successfully created multipart upload",
                    Details.of("object_key", key, "upload_id", created.getValue().getUploadId()), start);
        }
    }

    private void checkPartUpload() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("multipart-parts-test");
        long start = CategoryRunner.startTimer();
        GatewayResult<MultipartUpload> created = create(key, null);
        if (created.isFailure()) {
            runner.failWithError("multipart_part_upload", "Failed to create upload for part upload",
                    created.getError(), start);
            return;
        }
        String uploadId = created.getValue().getUploadId();

        List<UploadedPart> parts = new ArrayList<>();
        for (int partNumber = 1; partNumber <= PART_COUNT; partNumber++) {
            String name = "multipart_part_upload_" + partNumber;
            byte[] data = partData(partNumber, chunkSize);
            start = CategoryRunner.startTimer();
            GatewayResult<UploadedPart> uploaded = gateway.uploadPart(
                    new UploadPartOperation(bucket, key, uploadId, partNumber, data));
            if (uploaded.isFailure()) {
                runner.failWithError(name, "Failed to upload part " + partNumber, uploaded.getError(), start);
            } else if (uploaded.getValue().getEtag() == null) {
                runner.fail(name, "Part " + partNumber + " upload response missing ETag",
                        Details.of("object_key", key, "part_number", partNumber), start);
            } else {
                parts.add(UploadedPart.builder()
                        .partNumber(partNumber)
                        .etag(uploaded.getValue().getEtag())
                        .size((long) data.length)
                        .build());
                runner.pass(name, "Successfully uploaded part " + partNumber + " (" + data.length + " bytes)",
                        Details.of("object_key", key, "part_number", partNumber, "part_size", data.length,
                                "etag", uploaded.getValue().getEtag(), "upload_id", uploadId), start);
            }
        }

        if (parts.size() == PART_COUNT) {
            pending = new PendingUpload(key, uploadId, parts);
        }
    }

    private void checkListParts() {
        long start = CategoryRunner.startTimer();
        if (pending == null) {
            runner.fail("multipart_list_parts", "No multipart upload available for list parts test", Map.of(), start);
            return;
        }
        GatewayResult<List<UploadedPart>> listed = gateway.listParts(
                new ListPartsOperation(runner.getBucketName(), pending.key(), pending.uploadId()));
        if (listed.isFailure()) {
            runner.failWithError("multipart_list_parts", "Failed to list multipart parts", listed.getError(), start);
            return;
        }
        List<UploadedPart> actual = listed.getValue();
        List<UploadedPart> expected = pending.parts();
        if (actual.size() != expected.size()) {
            runner.fail("multipart_list_parts", "Expected " + expected.size() + " parts, got " + actual.size(),
                    Details.of("expected_count", expected.size(), "actual_count", actual.size()), start);
            return;
        }
        for (int i = 0; i < expected.size(); i++) {
            if (actual.get(i).getPartNumber() != expected.get(i).getPartNumber()
                    || !expected.get(i).getEtag().equals(actual.get(i).getEtag())) {
                runner.fail("multipart_list_parts", "Listed parts don't match uploaded parts",
                        Details.of("expected_parts", expected, "listed_parts", actual), start);
                return;
            }
        }
        runner.pass("multipart_list_parts", "Successfully listed " + actual.size() + " parts",
                Details.of("object_key", pending.key(), "upload_id", pending.uploadId(),
                        "parts_count", actual.size()), start);
    }

    private void checkCompletion() {
        long start = CategoryRunner.startTimer();
        if (pending == null) {
            runner.fail("multipart_completion", "No multipart upload available for completion test", Map.of(), start);
            return;
        }
        String bucket = runner.getBucketName();
        List<UploadedPart> parts = pending.parts().stream()
                .map(part -> UploadedPart.builder().partNumber(part.getPartNumber()).etag(part.getEtag()).build())
                .toList();
        GatewayResult<StoredObject> completed = gateway.completeMultipartUpload(
                new CompleteMultipartUploadOperation(bucket, pending.key(), pending.uploadId(), parts));
        if (completed.isFailure()) {
            runner.failWithError("multipart_completion", "Failed to complete multipart upload",
                    completed.getError(), start);
            return;
        }
        if (completed.getValue().getEtag() == null) {
            runner.fail("multipart_completion", "Multipart completion response missing ETag",
                    Details.of("object_key", pending.key()), start);
            return;
        }
        runner.pass("multipart_completion", "Successfully completed multipart upload",
                Details.of("object_key", pending.key(), "upload_id", pending.uploadId(),
                        "final_etag", completed.getValue().getEtag(), "parts_count", parts.size()), start);

        // The upload is now an object
        runner.forgetCleanupItem(CleanupItem.multipartUpload(bucket, pending.key(), pending.uploadId()));
        runner.addCleanupItem(CleanupItem.object(bucket, pending.key()));

        long expectedSize = pending.parts().stream().mapToLong(UploadedPart::getSize).sum();
        start = CategoryRunner.startTimer();
        GatewayResult<ObjectMetadata> head = gateway.headObject(new HeadObjectOperation(bucket, pending.key()));
        if (head.isFailure()) {
            runner.failWithError("multipart_completion_verification", "Failed to verify completed object",
                    head.getError(), start);
            return;
        }
        Long actualSize = head.getValue().getContentLength();
        Map<String, Object> details = Details.of("object_key", pending.key(),
                "expected_size", expectedSize, "actual_size", actualSize);
        if (actualSize != null && actualSize == expectedSize) {
            runner.pass("multipart_completion_verification",
                    "Completed object has correct size (" + actualSize + " bytes)", details, start);
        } else {
            runner.fail("multipart_completion_verification",
                    "Completed object size mismatch: expected " + expectedSize + ", got " + actualSize, details, start);
        }
        pending = null;
    }

    private void checkAbort() {
        String bucket = runner.getBucketName();
        String key = runner.generateUniqueName("multipart-abort-test");
        long start = CategoryRunner.startTimer();
        GatewayResult<MultipartUpload> created = create(key, null);
        if (created.isFailure()) {
            runner.failWithError("multipart_abort", "Failed to create upload to abort", created.getError(), start);
            return;
        }
        String uploadId = created.getValue().getUploadId();
        GatewayResult<UploadedPart> uploaded = gateway.uploadPart(
                new UploadPartOperation(bucket, key, uploadId, 1, partData(1, 1024)));
        if (uploaded.isFailure()) {
            runner.failWithError("multipart_abort", "Failed to upload part before abort", uploaded.getError(), start);
            return;
        }

        start = CategoryRunner.startTimer();
        GatewayResult<Void> aborted = gateway.abortMultipartUpload(
                new AbortMultipartUploadOperation(bucket, key, uploadId));
        if (aborted.isFailure()) {
            runner.failWithError("multipart_abort", "Failed to abort multipart upload", aborted.getError(), start);
            return;
        }
        runner.forgetCleanupItem(CleanupItem.multipartUpload(bucket, key, uploadId));
        runner.pass("multipart_abort", "Successfully aborted multipart upload",
                Details.of("object_key", key, "upload_id", uploadId), start);

        start = CategoryRunner.startTimer();
        GatewayResult<List<UploadedPart>> listed = gateway.listParts(new ListPartsOperation(bucket, key, uploadId));
        Map<String, Object> details = Details.of("object_key", key, "upload_id", uploadId);
        if (listed.isSuccess()) {
            runner.fail("multipart_abort_verification",
                    "List parts succeeded after abort (upload should not exist)", details, start);
        } else if (listed.failedWith(404)) {
            runner.pass("multipart_abort_verification", "Aborted upload correctly not found (404)", details, start);
        } else {
            runner.failWithError("multipart_abort_verification", "Unexpected error verifying abort",
                    listed.getError(), start);
        }
    }

    private void checkListUploads() {
        long start = CategoryRunner.startTimer();
        GatewayResult<List<MultipartUpload>> uploads = gateway.listMultipartUploads(
                new ListMultipartUploadsOperation(runner.getBucketName(), null));
        if (uploads.isFailure()) {
            runner.failWithError("multipart_list_uploads", "Failed to list multipart uploads",
                    uploads.getError(), start);
            return;
        }
        int count = uploads.getValue().size();
        runner.pass("multipart_list_uploads", "Successfully listed multipart uploads (" + count + " found)",
                Details.of("uploads_count", count), start);
    }

    @Override
    public List<CleanupError> cleanup() {
        return runner.cleanup();
    }

    @Override
    public CategorySummary getSummary() {
        return runner.getSummary();
    }

    private record PendingUpload(String key, String uploadId, List<UploadedPart> parts) {
    }
}
