package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * System and user metadata of an object, as returned by HeadObject and GetObject
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectMetadata {

    private String bucketName;

    private String key;

    private Long contentLength;

    private String etag;

    private String contentType;

    private Instant lastModified;

    private String versionId;

    private String storageClass;

    /**
     * User metadata (x-amz-meta-*), keys without the prefix
     */
    @Builder.Default
    private Map<String, String> userMetadata = Map.of();

    // ==================== Standard headers ====================

    private String contentEncoding;

    private String contentDisposition;

    private String contentLanguage;

    private String cacheControl;

    private Instant expires;
}
