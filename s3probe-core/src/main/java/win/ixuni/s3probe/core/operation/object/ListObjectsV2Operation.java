package win.ixuni.s3probe.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * List objects V2 operation (continuation-token based)
 */
@Value
@Builder
public class ListObjectsV2Operation implements Operation<ListObjectsResult> {

    String bucketName;

    String prefix;

    String continuationToken;

    String delimiter;

    Integer maxKeys;

    public static ListObjectsV2Operation of(String bucketName, String prefix) {
        return ListObjectsV2Operation.builder().bucketName(bucketName).prefix(prefix).build();
    }
}
