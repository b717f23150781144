package win.ixuni.s3probe.gateway.memory.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.s3probe.core.exception.GatewayException;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.GatewayContext;
import win.ixuni.s3probe.core.operation.OperationHandlerRegistry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Memory gateway context
 * <p>
 * The in-process object store shared by all memory handlers, with the S3 validation rules the
 * handlers apply.
 */
@Getter
@Builder
public class MemoryGatewayContext implements GatewayContext {

    public static final String GATEWAY_TYPE = "memory";

    /**
     * Minimum size of every part but the last one
     */
    public static final long MIN_PART_SIZE = 5L * 1024 * 1024;

    /**
     * Limit on the summed size of user metadata keys and values
     */
    public static final int MAX_USER_METADATA_BYTES = 2048;

    private static final Pattern BUCKET_NAME = Pattern.compile("^[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]$");
    private static final Pattern IP_ADDRESS = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private final String storeName;

    /**
     * Bucket store: bucketName -> BucketState
     */
    @Builder.Default
    private final Map<String, BucketState> buckets = new ConcurrentHashMap<>();

    /**
     * Multipart upload state: uploadId -> MultipartState
     */
    @Builder.Default
    private final Map<String, MultipartState> multipartUploads = new ConcurrentHashMap<>();

    @Builder.Default
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Operation handler registry (injected at runtime)
     */
    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getGatewayType() {
        return GATEWAY_TYPE;
    }

    @Override
    public String getTarget() {
        return "memory://" + storeName;
    }

    // ============ Data Structure Definitions ============

    @Getter
    public static class BucketState {
        private final String name;
        private final Instant creationDate;
        /**
         * key -> versions, oldest first
         */
        private final NavigableMap<String, List<ObjectData>> objects = new ConcurrentSkipListMap<>();
        private final Map<String, String> tags = new LinkedHashMap<>();
        @Setter
        private volatile String versioningStatus;

        public BucketState(String name, Instant creationDate) {
            this.name = name;
            this.creationDate = creationDate;
        }

        public boolean isVersioningEnabled() {
            return "Enabled".equals(versioningStatus);
        }

        /**
         * Latest version of {@code key}, null when absent or deleted
         */
        public ObjectData latest(String key) {
            List<ObjectData> versions = objects.get(key);
            if (versions == null || versions.isEmpty()) {
                return null;
            }
            ObjectData latest = versions.get(versions.size() - 1);
            return latest.isDeleteMarker() ? null : latest;
        }

        public ObjectData version(String key, String versionId) {
            List<ObjectData> versions = objects.get(key);
            if (versions == null) {
                return null;
            }
            return versions.stream()
                    .filter(v -> versionId.equals(v.getVersionId()))
                    .findFirst()
                    .orElse(null);
        }

        public boolean isEmpty() {
            return objects.values().stream().allMatch(List::isEmpty);
        }
    }

    @Getter
    @Builder(toBuilder = true)
    public static class ObjectData {
        private final String key;
        private final byte[] data;
        private final String etag;
        private final String contentType;
        private final Instant lastModified;
        private final Map<String, String> metadata;
        private final String contentEncoding;
        private final String contentDisposition;
        private final String contentLanguage;
        private final String cacheControl;
        private final Instant expires;
        /**
         * "null" for objects written while versioning was off
         */
        private final String versionId;
        private final boolean deleteMarker;
        /**
         * Parts of a completed multipart upload, null for single-request uploads
         */
        private final List<UploadedPart> parts;
        @Builder.Default
        private final Map<String, String> tags = new LinkedHashMap<>();
    }

    @Getter
    @Builder
    public static class MultipartState {
        private final String uploadId;
        private final String bucketName;
        private final String key;
        private final String contentType;
        private final Map<String, String> metadata;
        private final Instant initiated;
        @Builder.Default
        private final Map<Integer, PartData> parts = new ConcurrentHashMap<>();
    }

    @Getter
    @Builder
    public static class PartData {
        private final byte[] data;
        private final String etag;
        private final Instant lastModified;
    }

    // ============ Utility Methods ============

    /**
     * @throws GatewayException NoSuchBucket when absent
     */
    public BucketState requireBucket(String bucketName) {
        BucketState bucket = bucketName != null ? buckets.get(bucketName) : null;
        if (bucket == null) {
            throw GatewayException.noSuchBucket(bucketName);
        }
        return bucket;
    }

    /**
     * Latest version, or the requested one
     *
     * @throws GatewayException NoSuchKey / NoSuchVersion when absent
     */
    public ObjectData requireObject(String bucketName, String key, String versionId) {
        BucketState bucket = requireBucket(bucketName);
        if (versionId == null) {
            ObjectData latest = bucket.latest(key);
            if (latest == null) {
                throw GatewayException.noSuchKey(bucketName, key);
            }
            return latest;
        }
        ObjectData version = bucket.version(key, versionId);
        if (version == null) {
            throw new GatewayException("NoSuchVersion", "The specified version does not exist: " + versionId, 404);
        }
        if (version.isDeleteMarker()) {
            throw new GatewayException("MethodNotAllowed", "The specified version is a delete marker", 405);
        }
        return version;
    }

    /**
     * Store a new version of an object, replacing the "null" version when versioning is off
     */
    public ObjectData store(BucketState bucket, ObjectData.ObjectDataBuilder builder) {
        ObjectData object = builder
                .versionId(bucket.isVersioningEnabled() ? nextVersionId() : "null")
                .lastModified(Instant.now())
                .build();
        synchronized (bucket) {
            List<ObjectData> versions = bucket.getObjects().computeIfAbsent(object.getKey(), k -> new ArrayList<>());
            if (!bucket.isVersioningEnabled()) {
                versions.removeIf(v -> "null".equals(v.getVersionId()));
            }
            versions.add(object);
        }
        return object;
    }

    public String nextVersionId() {
        return String.format("%016x%08x", System.currentTimeMillis(), sequence.incrementAndGet());
    }

    public String nextUploadId() {
        return UUID.randomUUID().toString().replace("-", "") + Long.toHexString(sequence.incrementAndGet());
    }

    public static void validateBucketName(String bucketName) {
        if (bucketName == null || !BUCKET_NAME.matcher(bucketName).matches()
                || bucketName.contains("..") || bucketName.contains(".-") || bucketName.contains("-.")
                || IP_ADDRESS.matcher(bucketName).matches()) {
            throw new GatewayException("InvalidBucketName", "The specified bucket is not valid: " + bucketName, 400);
        }
    }

    public static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw GatewayException.invalidArgument("Object key must not be empty");
        }
        if (key.getBytes(StandardCharsets.UTF_8).length > 1024) {
            throw new GatewayException("KeyTooLongError", "Your key is too long", 400);
        }
        for (char c : key.toCharArray()) {
            if (c < 0x20) {
                throw GatewayException.invalidArgument("Object key contains a control character");
            }
        }
    }

    /**
     * Lower-cases keys like HTTP headers do and enforces the user metadata size limit
     */
    public static Map<String, String> normalizeMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        int size = 0;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            String value = entry.getValue() != null ? entry.getValue() : "";
            size += key.getBytes(StandardCharsets.UTF_8).length + value.getBytes(StandardCharsets.UTF_8).length;
            normalized.put(key, value);
        }
        if (size > MAX_USER_METADATA_BYTES) {
            throw new GatewayException("MetadataTooLarge",
                    "Your metadata headers exceed the maximum allowed metadata size", 400);
        }
        return Collections.unmodifiableMap(normalized);
    }

    /**
     * @param maxTags 10 for objects, 50 for buckets
     */
    public static void validateTags(Map<String, String> tags, int maxTags) {
        if (tags == null) {
            throw new GatewayException("MalformedXML", "Tag set is missing", 400);
        }
        if (tags.size() > maxTags) {
            throw new GatewayException("BadRequest", "Object tags cannot be greater than " + maxTags, 400);
        }
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (tag.getKey() == null || tag.getKey().isEmpty() || tag.getKey().length() > 128) {
                throw new GatewayException("InvalidTag", "The TagKey you have provided is invalid", 400);
            }
            if (tag.getValue() == null || tag.getValue().length() > 256) {
                throw new GatewayException("InvalidTag", "The TagValue you have provided is invalid", 400);
            }
        }
    }

    public static String md5Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public static String quotedMd5(byte[] data) {
        return "\"" + md5Hex(data) + "\"";
    }
}
