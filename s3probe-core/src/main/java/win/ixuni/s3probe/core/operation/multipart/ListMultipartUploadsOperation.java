package win.ixuni.s3probe.core.operation.multipart;

import lombok.Value;
import win.ixuni.s3probe.core.model.MultipartUpload;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.List;

/**
 * List in-progress multipart uploads of a bucket
 */
@Value
public class ListMultipartUploadsOperation implements Operation<List<MultipartUpload>> {

    String bucketName;

    /**
     * Key prefix filter, null for all uploads
     */
    String prefix;
}
