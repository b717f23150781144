package win.ixuni.s3probe.core.operation.object;

import lombok.AllArgsConstructor;
import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Delete object operation. With a version id the version is removed permanently; without one a
 * versioned bucket gets a delete marker.
 */
@Value
@AllArgsConstructor
public class DeleteObjectOperation implements Operation<Void> {

    String bucketName;

    String key;

    String versionId;

    public DeleteObjectOperation(String bucketName, String key) {
        this(bucketName, key, null);
    }
}
