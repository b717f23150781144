package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.Map;

/**
 * Replace the bucket tag set
 */
@Value
public class PutBucketTaggingOperation implements Operation<Void> {

    /**
     * Bucket name
     */
    String bucketName;

    Map<String, String> tags;
}
