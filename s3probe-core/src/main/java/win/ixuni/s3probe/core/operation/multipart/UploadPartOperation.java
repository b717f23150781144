package win.ixuni.s3probe.core.operation.multipart;

import lombok.Value;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.Operation;

/**
 * Upload one part of a multipart upload
 */
@Value
public class UploadPartOperation implements Operation<UploadedPart> {

    String bucketName;

    String key;

    String uploadId;

    /**
     * 1 to 10000
     */
    int partNumber;

    byte[] content;

    @Override
    public TimeoutClass getTimeoutClass() {
        return TimeoutClass.UPLOAD;
    }
}
