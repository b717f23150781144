package win.ixuni.s3probe.checks.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds result detail maps. Unlike {@link Map#of}, null values are kept.
 */
public final class Details {

    private Details() {
    }

    /**
     * @param keyValues alternating keys and values
     */
    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Details need key/value pairs");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }

    /**
     * Insertion-ordered, unmodifiable string pairs for probe case tables
     */
    public static Map<String, String> cases(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Cases need key/value pairs");
        }
        Map<String, String> cases = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            cases.put(keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(cases);
    }
}
