package win.ixuni.s3probe.core.operation.multipart;

import lombok.AllArgsConstructor;
import lombok.Value;
import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.Map;

/**
 * Initiate a multipart upload
 */
@Value
@AllArgsConstructor
public class CreateMultipartUploadOperation implements Operation<MultipartUpload> {

    String bucketName;

    String key;

    String contentType;

    Map<String, String> metadata;

    public CreateMultipartUploadOperation(String bucketName, String key) {
        this(bucketName, key, null, Map.of());
    }
}
