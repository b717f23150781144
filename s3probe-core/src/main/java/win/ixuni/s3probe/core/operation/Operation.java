package win.ixuni.s3probe.core.operation;

/**
 * Base interface of every S3 operation a gateway can execute.
 * <p>
 * Each verb is an immutable command object (CreateBucket, PutObject, ...); the type parameter is the
 * payload of a successful response. Gateways register one handler per operation type.
 *
 * @param <R> result type
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging)
     *
     * @return e.g. "CreateBucket", "PutObject"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        // Remove "Operation" suffix
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }

    /**
     * Which configured timeout applies to this operation
     */
    default TimeoutClass getTimeoutClass() {
        return TimeoutClass.STANDARD;
    }

    enum TimeoutClass {
        STANDARD,
        UPLOAD,
        DOWNLOAD
    }
}
