package win.ixuni.s3probe.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.Map;

/**
 * Server-side copy operation
 */
@Value
@Builder
public class CopyObjectOperation implements Operation<StoredObject> {

    String sourceBucket;

    String sourceKey;

    String destinationBucket;

    String destinationKey;

    /**
     * COPY keeps the source metadata; REPLACE uses {@link #metadata} and {@link #contentType}
     */
    @Builder.Default
    MetadataDirective metadataDirective = MetadataDirective.COPY;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    String contentType;

    public static CopyObjectOperation of(String bucketName, String sourceKey, String destinationKey) {
        return CopyObjectOperation.builder()
                .sourceBucket(bucketName)
                .sourceKey(sourceKey)
                .destinationBucket(bucketName)
                .destinationKey(destinationKey)
                .build();
    }

    public enum MetadataDirective {
        COPY,
        REPLACE
    }
}
