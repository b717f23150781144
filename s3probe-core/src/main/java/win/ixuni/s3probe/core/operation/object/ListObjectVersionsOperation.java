package win.ixuni.s3probe.core.operation.object;

import lombok.Value;
import win.ixuni.s3probe.core.model.ObjectVersion;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.List;

/**
 * List object versions and delete markers
 */
@Value
public class ListObjectVersionsOperation implements Operation<List<ObjectVersion>> {

    String bucketName;

    /**
     * Key prefix, all keys when null
     */
    String prefix;
}
