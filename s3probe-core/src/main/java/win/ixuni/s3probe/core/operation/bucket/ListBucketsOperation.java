package win.ixuni.s3probe.core.operation.bucket;

import lombok.Value;
import win.ixuni.s3probe.core.model.BucketInfo;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.List;

/**
 * List buckets operation
 */
@Value
public class ListBucketsOperation implements Operation<List<BucketInfo>> {
}
