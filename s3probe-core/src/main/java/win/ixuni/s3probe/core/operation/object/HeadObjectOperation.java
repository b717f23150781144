package win.ixuni.s3probe.core.operation.object;

import lombok.AllArgsConstructor;
import lombok.Value;
import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Head object operation
 */
@Value
@AllArgsConstructor
public class HeadObjectOperation implements Operation<ObjectMetadata> {

    String bucketName;

    String key;

    /**
     * Specific version, latest when null
     */
    String versionId;

    public HeadObjectOperation(String bucketName, String key) {
        this(bucketName, key, null);
    }
}
