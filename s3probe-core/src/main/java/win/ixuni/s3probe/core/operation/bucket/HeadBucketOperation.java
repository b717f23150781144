package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Head bucket operation
 */
@Value
public class HeadBucketOperation implements Operation<Void> {

    /**
     * Bucket name
     */
    String bucketName;
}
