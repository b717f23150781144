package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of a ListObjects / ListObjectsV2 response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectSummary {

    private String key;

    private Long size;

    private String etag;

    private Instant lastModified;

    private String storageClass;
}
