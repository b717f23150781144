package win.ixuni.s3probe.core.operation.object;

import lombok.Value;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.Map;

/**
 * Replace the object tag set
 */
@Value
public class PutObjectTaggingOperation implements Operation<Void> {

    String bucketName;

    String key;

    Map<String, String> tags;
}
