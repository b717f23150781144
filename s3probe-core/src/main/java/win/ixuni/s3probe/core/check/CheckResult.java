package win.ixuni.s3probe.core.check;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one probe assertion.
 * <p>
 * {@code details} is a diagnostic payload for reports and is never interpreted programmatically.
 */
@Value
public class CheckResult {

    /**
     * Stable probe identifier, e.g. "object_download"
     */
    String name;

    boolean success;

    String message;

    Map<String, Object> details;

    /**
     * Seconds spent on the probe
     */
    double duration;

    Instant timestamp;

    public CheckResult(String name, boolean success, String message, Map<String, Object> details,
                       double duration, Instant timestamp) {
        this.name = name;
        this.success = success;
        this.message = message;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
        this.duration = duration;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static CheckResult pass(String name, String message, Map<String, Object> details, double duration) {
        return new CheckResult(name, true, message, details, duration, Instant.now());
    }

    public static CheckResult fail(String name, String message, Map<String, Object> details, double duration) {
        return new CheckResult(name, false, message, details, duration, Instant.now());
    }
}
