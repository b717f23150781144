package win.ixuni.s3probe.core.operation.object;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.Map;

/**
 * Get object tag set
 */
@Value
public class GetObjectTaggingOperation implements Operation<Map<String, String>> {

    String bucketName;

    String key;
}
