package win.ixuni.s3probe.core.operation.object;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Delete object tag set
 */
@Value
public class DeleteObjectTaggingOperation implements Operation<Void> {

    String bucketName;

    String key;
}
