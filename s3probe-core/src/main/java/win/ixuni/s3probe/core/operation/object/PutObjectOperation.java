package win.ixuni.s3probe.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.Operation;

import java.time.Instant;
import java.util.Map;

/**
 * Put object operation
 */
@Value
@Builder
public class PutObjectOperation implements Operation<StoredObject> {

    String bucketName;

    String key;

    /**
     * Object content, uploaded in a single request
     */
    @Builder.Default
    byte[] content = new byte[0];

    /**
     * Content type, backend default when null
     */
    String contentType;

    /**
     * User metadata, sent as x-amz-meta-* headers
     */
    @Builder.Default
    Map<String, String> metadata = Map.of();

    String contentEncoding;

    String contentDisposition;

    String contentLanguage;

    String cacheControl;

    Instant expires;

    public static PutObjectOperation of(String bucketName, String key, byte[] content) {
        return PutObjectOperation.builder().bucketName(bucketName).key(key).content(content).build();
    }

    @Override
    public TimeoutClass getTimeoutClass() {
        return TimeoutClass.UPLOAD;
    }
}
