package win.ixuni.s3probe.core.check;

import org.slf4j.Logger;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.model.ObjectSummary;
import win.ixuni.s3probe.core.model.ObjectVersion;
import win.ixuni.s3probe.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.s3probe.core.operation.multipart.AbortMultipartUploadOperation;
import win.ixuni.s3probe.core.operation.multipart.ListMultipartUploadsOperation;
import win.ixuni.s3probe.core.operation.object.DeleteObjectOperation;
import win.ixuni.s3probe.core.operation.object.ListObjectVersionsOperation;
import win.ixuni.s3probe.core.operation.object.ListObjectsV2Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Resources created by one category run, torn down in dependency order.
 * <p>
 * Owned and mutated by a single category's execution path only.
 */
public class CleanupRegistry {

    /**
     * Bound on listing pages when emptying a bucket
     */
    private static final int MAX_LIST_PAGES = 100;

    private final StorageGateway gateway;
    private final Logger log;
    private final List<CleanupItem> items = new ArrayList<>();

    public CleanupRegistry(StorageGateway gateway, Logger log) {
        this.gateway = gateway;
        this.log = log;
    }

    /**
     * Queue a resource that was just confirmed to exist remotely
     */
    public void register(CleanupItem item) {
        items.add(item);
        log.debug("Registered for cleanup: {}", item.describe());
    }

    /**
     * Drop a queued resource that a probe already deleted or replaced
     *
     * @return true when the item was queued
     */
    public boolean forget(CleanupItem item) {
        return items.remove(item);
    }

    public List<CleanupItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    /**
     * Tear down every queued resource: objects, then multipart uploads, then buckets.
     * <p>
     * A failing item is logged and collected; the remaining items are still processed. The registry is
     * empty afterwards whatever happened, so a second call is a no-op.
     *
     * @return teardown failures, empty when everything was removed
     */
    public List<CleanupError> drain() {
        if (items.isEmpty()) {
            return List.of();
        }
        List<CleanupItem> ordered = new ArrayList<>(items);
        ordered.sort(Comparator.comparingInt(CleanupItem::priority));
        items.clear();

        log.info("Cleaning up {} resources", ordered.size());
        List<CleanupError> errors = new ArrayList<>();
        for (CleanupItem item : ordered) {
            try {
                CleanupError error = teardown(item);
                if (error != null) {
                    log.warn("{}", error);
                    errors.add(error);
                } else {
                    log.debug("Cleaned up {}", item.describe());
                }
            } catch (RuntimeException e) {
                CleanupError error = CleanupError.of(item, e);
                log.warn("{}", error, e);
                errors.add(error);
            }
        }
        return errors;
    }

    private CleanupError teardown(CleanupItem item) {
        if (item instanceof CleanupItem.ObjectItem object) {
            return check(item, gateway.deleteObject(
                    new DeleteObjectOperation(object.bucket(), object.key(), object.versionId())));
        }
        if (item instanceof CleanupItem.MultipartUploadItem upload) {
            return check(item, gateway.abortMultipartUpload(
                    new AbortMultipartUploadOperation(upload.bucket(), upload.key(), upload.uploadId())));
        }
        try {
            emptyBucket(item.bucket());
        } catch (RuntimeException e) {
            log.debug("Emptying bucket {} failed, deleting it anyway", item.bucket(), e);
        }
        return check(item, gateway.deleteBucket(new DeleteBucketOperation(item.bucket())));
    }

    /**
     * Already gone counts as cleaned up
     */
    private CleanupError check(CleanupItem item, GatewayResult<Void> result) {
        if (result.isSuccess() || result.getError().isNotFound()) {
            return null;
        }
        return CleanupError.of(item, result.getError());
    }

    /**
     * Best-effort removal of whatever probes left behind: versions, objects and in-flight uploads.
     */
    private void emptyBucket(String bucket) {
        GatewayResult<List<ObjectVersion>> versions =
                gateway.listObjectVersions(new ListObjectVersionsOperation(bucket, null));
        if (versions.isSuccess()) {
            for (ObjectVersion version : versions.getValue()) {
                if (version.getVersionId() != null) {
                    deleteQuietly(new DeleteObjectOperation(bucket, version.getKey(), version.getVersionId()));
                }
            }
        }

        String token = null;
        for (int page = 0; page < MAX_LIST_PAGES; page++) {
            GatewayResult<ListObjectsResult> listing = gateway.listObjectsV2(ListObjectsV2Operation.builder()
                    .bucketName(bucket)
                    .continuationToken(token)
                    .build());
            if (listing.isFailure()) {
                log.debug("Could not list {} before deletion: {}", bucket, listing.getError().describe());
                break;
            }
            for (ObjectSummary summary : listing.getValue().getObjects()) {
                deleteQuietly(new DeleteObjectOperation(bucket, summary.getKey()));
            }
            token = listing.getValue().getNextToken();
            if (!listing.getValue().isTruncated() || token == null) {
                break;
            }
        }

        GatewayResult<List<MultipartUpload>> uploads =
                gateway.listMultipartUploads(new ListMultipartUploadsOperation(bucket, null));
        if (uploads.isSuccess()) {
            for (MultipartUpload upload : uploads.getValue()) {
                GatewayResult<Void> aborted = gateway.abortMultipartUpload(
                        new AbortMultipartUploadOperation(bucket, upload.getKey(), upload.getUploadId()));
                if (aborted.isFailure()) {
                    log.debug("Could not abort upload {}: {}", upload.getUploadId(), aborted.getError().describe());
                }
            }
        }
    }

    private void deleteQuietly(DeleteObjectOperation operation) {
        GatewayResult<Void> deleted = gateway.deleteObject(operation);
        if (deleted.isFailure() && !deleted.getError().isNotFound()) {
            log.debug("Could not delete {}/{}: {}",
                    operation.getBucketName(), operation.getKey(), deleted.getError().describe());
        }
    }
}
