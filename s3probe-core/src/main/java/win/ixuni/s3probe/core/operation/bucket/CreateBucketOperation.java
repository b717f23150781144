package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Create bucket operation
 */
@Value
public class CreateBucketOperation implements Operation<Void> {

    /**
     * Bucket name
     */
    String bucketName;
}
