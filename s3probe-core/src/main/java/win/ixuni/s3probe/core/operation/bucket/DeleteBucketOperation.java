package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Delete bucket operation. Fails with 409 when the bucket is not empty.
 */
@Value
public class DeleteBucketOperation implements Operation<Void> {

    /**
     * Bucket name
     */
    String bucketName;
}
