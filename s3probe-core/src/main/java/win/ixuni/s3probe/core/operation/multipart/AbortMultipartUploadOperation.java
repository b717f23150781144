package win.ixuni.s3probe.core.operation.multipart;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Abort a multipart upload and discard its parts
 */
@Value
public class AbortMultipartUploadOperation implements Operation<Void> {

    String bucketName;

    String key;

    String uploadId;
}
