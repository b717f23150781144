package win.ixuni.s3probe.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * JSON helpers for run exports
 */
public final class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonUtils() {
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize to JSON", e);
        }
    }

    public static void writeJson(Writer writer, Object obj) {
        try {
            MAPPER.writeValue(writer, obj);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
