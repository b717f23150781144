package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Get bucket policy document (JSON)
 */
@Value
public class GetBucketPolicyOperation implements Operation<String> {

    /**
     * Bucket name
     */
    String bucketName;
}
