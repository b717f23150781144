package win.ixuni.s3probe.core.operation.multipart;

import lombok.Value;
import win.ixuni.s3probe.core.model.UploadedPart;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.List;

/**
 * List the uploaded parts of a multipart upload
 */
@Value
public class ListPartsOperation implements Operation<List<UploadedPart>> {

    String bucketName;

    String key;

    String uploadId;
}
