package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Put bucket versioning status
 */
@Value
public class PutBucketVersioningOperation implements Operation<Void> {

    /**
     * Bucket name
     */
    String bucketName;

    /**
     * "Enabled" or "Suspended"; any other value is sent as-is
     */
    String status;
}
