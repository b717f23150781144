package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One version or delete marker from ListObjectVersions
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectVersion {

    private String key;

    private String versionId;

    private boolean latest;

    private boolean deleteMarker;

    private Long size;

    private String etag;

    private Instant lastModified;
}
