package win.ixuni.s3probe.core.operation.object;

import lombok.Value;
import win.ixuni.s3probe.core.model.ObjectAttribute;
import win.ixuni.s3probe.core.model.ObjectAttributes;
import win.ixuni.s3probe.core.operation.Operation;

import java.util.Set;

/**
 * Get object attributes operation
 */
@Value
public class GetObjectAttributesOperation implements Operation<ObjectAttributes> {

    String bucketName;

    String key;

    /**
     * Attributes to request
     */
    Set<ObjectAttribute> attributes;
}
