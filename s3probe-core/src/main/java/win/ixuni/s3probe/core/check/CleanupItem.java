package win.ixuni.s3probe.core.check;

/**
 * A remote resource created during probing that has to be torn down afterwards.
 * <p>
 * {@link #priority()} fixes the teardown order: objects first, then multipart uploads, then buckets,
 * since a bucket can only be deleted once it is empty.
 */
public interface CleanupItem {

    String bucket();

    int priority();

    String describe();

    static ObjectItem object(String bucket, String key) {
        return new ObjectItem(bucket, key, null);
    }

    static ObjectItem objectVersion(String bucket, String key, String versionId) {
        return new ObjectItem(bucket, key, versionId);
    }

    static MultipartUploadItem multipartUpload(String bucket, String key, String uploadId) {
        return new MultipartUploadItem(bucket, key, uploadId);
    }

    static BucketItem bucket(String bucket) {
        return new BucketItem(bucket);
    }

    /**
     * An object, or one specific version of it when {@code versionId} is set
     */
    record ObjectItem(String bucket, String key, String versionId) implements CleanupItem {

        @Override
        public int priority() {
            return 0;
        }

        @Override
        public String describe() {
            return versionId == null
                    ? "object " + bucket + "/" + key
                    : "object " + bucket + "/" + key + " (version " + versionId + ")";
        }
    }

    record MultipartUploadItem(String bucket, String key, String uploadId) implements CleanupItem {

        @Override
        public int priority() {
            return 1;
        }

        @Override
        public String describe() {
            return "multipart upload " + uploadId + " of " + bucket + "/" + key;
        }
    }

    record BucketItem(String bucket) implements CleanupItem {

        @Override
        public int priority() {
            return 2;
        }

        @Override
        public String describe() {
            return "bucket " + bucket;
        }
    }
}
