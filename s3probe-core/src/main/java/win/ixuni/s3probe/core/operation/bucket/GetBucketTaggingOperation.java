package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.Map;

/**
 * Get bucket tag set
 */
@Value
public class GetBucketTaggingOperation implements Operation<Map<String, String>> {

    /**
     * Bucket name
     */
    String bucketName;
}
