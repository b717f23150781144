package win.ixuni.s3probe.core.gateway;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Outcome of a gateway operation: either a payload or a {@link GatewayError}.
 * <p>
 * A successful result may carry a {@code null} payload for operations without a response body
 * (delete, put tagging, abort).
 *
 * @param <T> payload type
 */
public final class GatewayResult<T> {

    private final T value;
    private final GatewayError error;

    private GatewayResult(T value, GatewayError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> GatewayResult<T> success(T value) {
        return new GatewayResult<>(value, null);
    }

    public static <T> GatewayResult<T> failure(GatewayError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new GatewayResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws NoSuchElementException when this is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("Gateway operation failed: " + error.describe());
        }
        return value;
    }

    /**
     * @throws NoSuchElementException when this is a success
     */
    public GatewayError getError() {
        if (error == null) {
            throw new NoSuchElementException("Gateway operation succeeded, no error present");
        }
        return error;
    }

    /**
     * True when this is a failure whose HTTP status is one of {@code statuses}
     */
    public boolean failedWith(int... statuses) {
        return error != null && error.hasStatus(statuses);
    }

    public <U> GatewayResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null ? "GatewayResult.success(" + value + ")" : "GatewayResult.failure(" + error.describe() + ")";
    }
}
