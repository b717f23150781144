package win.ixuni.s3probe.core.operation.multipart;

import lombok.Value;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.List;

/**
 * Complete a multipart upload from the listed parts
 */
@Value
public class CompleteMultipartUploadOperation implements Operation<StoredObject> {

    String bucketName;

    String key;

    String uploadId;

    /**
     * Part numbers and ETags, in ascending part number order
     */
    List<UploadedPart> parts;
}
