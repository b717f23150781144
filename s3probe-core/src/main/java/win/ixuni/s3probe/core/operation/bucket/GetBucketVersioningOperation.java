package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Get bucket versioning status. The result is null when versioning was never configured.
 */
@Value
public class GetBucketVersioningOperation implements Operation<String> {

    /**
     * Bucket name
     */
    String bucketName;
}
