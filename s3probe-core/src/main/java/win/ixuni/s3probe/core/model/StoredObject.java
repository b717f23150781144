package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a write that produced an object: PutObject, CopyObject, CompleteMultipartUpload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredObject {

    private String bucketName;

    private String key;

    private String etag;

    /**
     * Only present when versioning is enabled on the bucket
     */
    private String versionId;

    /**
     * Object size when the backend reports it, otherwise null
     */
    private Long size;
}
