package win.ixuni.s3probe.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * List objects operation (v1, marker based)
 */
@Value
@Builder
public class ListObjectsOperation implements Operation<ListObjectsResult> {

    String bucketName;

    String prefix;

    String marker;

    String delimiter;

    Integer maxKeys;
}
