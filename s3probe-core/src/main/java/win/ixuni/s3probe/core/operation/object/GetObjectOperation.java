package win.ixuni.s3probe.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3probe.core.model.ObjectContent;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Get object operation, optionally a range of a specific version
 */
@Value
@Builder
public class GetObjectOperation implements Operation<ObjectContent> {

    String bucketName;

    String key;

    /**
     * Raw Range header value, e.g. "bytes=0-99" or "bytes=-100". Sent verbatim so that malformed
     * values reach the backend unchanged.
     */
    String range;

    String versionId;

    /**
     * If-Range header value (an ETag or HTTP date)
     */
    String ifRange;

    public static GetObjectOperation of(String bucketName, String key) {
        return GetObjectOperation.builder().bucketName(bucketName).key(key).build();
    }

    public static GetObjectOperation range(String bucketName, String key, String range) {
        return GetObjectOperation.builder().bucketName(bucketName).key(key).range(range).build();
    }

    @Override
    public TimeoutClass getTimeoutClass() {
        return TimeoutClass.DOWNLOAD;
    }
}
