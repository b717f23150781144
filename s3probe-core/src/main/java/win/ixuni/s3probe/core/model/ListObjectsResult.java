package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * ListObjects (v1) and ListObjectsV2 result
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListObjectsResult {

    private String bucketName;

    private String prefix;

    @Builder.Default
    private List<ObjectSummary> objects = List.of();

    @Builder.Default
    private List<String> commonPrefixes = List.of();

    private boolean truncated;

    /**
     * NextContinuationToken for v2, NextMarker for v1
     */
    private String nextToken;

    private Integer keyCount;

    public List<String> keys() {
        return objects.stream().map(ObjectSummary::getKey).toList();
    }
}
