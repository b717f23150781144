package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Delete bucket tag set
 */
@Value
public class DeleteBucketTaggingOperation implements Operation<Void> {

    /**
     * Bucket name
     */
    String bucketName;
}
