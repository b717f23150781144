package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bucket as returned by ListBuckets
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketInfo {

    private String name;

    /**
     * May be null when the backend omits it
     */
    private Instant creationDate;
}
