package win.ixuni.s3probe.checks.support;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Test data generator
 * <p>
 * Payloads are deterministic so that a mismatch on download points at the exact offset that differs.
 */
public final class TestDataGenerator {

    /**
     * Lines in the range test object, each exactly {@link #RANGE_LINE_LENGTH} bytes
     */
    public static final int RANGE_LINES = 100;

    public static final int RANGE_LINE_LENGTH = 100;

    private TestDataGenerator() {
        // Utility class, not instantiable
    }

    /**
     * {@code "{content} - chunk N\n"} repeated and truncated to {@code size} bytes
     */
    public static byte[] generate(String content, int size) {
        if (size <= 0) {
            return new byte[0];
        }
        byte[] base = content.getBytes(StandardCharsets.UTF_8);
        if (base.length >= size) {
            return Arrays.copyOf(base, size);
        }
        byte[] data = new byte[size];
        int offset = 0;
        int chunk = 0;
        while (offset < size) {
            byte[] line = (content + " - chunk " + chunk++ + "\n").getBytes(StandardCharsets.UTF_8);
            int length = Math.min(line.length, size - offset);
            System.arraycopy(line, 0, data, offset, length);
            offset += length;
        }
        return data;
    }

    /**
     * {@code unit} repeated verbatim and truncated to {@code size} bytes
     */
    public static byte[] repeat(String unit, int size) {
        byte[] base = unit.getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[Math.max(size, 0)];
        for (int offset = 0; offset < data.length; offset += base.length) {
            System.arraycopy(base, 0, data, offset, Math.min(base.length, data.length - offset));
        }
        return data;
    }

    /**
     * 100 numbered lines of 100 bytes, newline included, so any offset can be verified by eye
     */
    public static byte[] rangeTestData() {
        StringBuilder builder = new StringBuilder(RANGE_LINES * RANGE_LINE_LENGTH);
        for (int i = 0; i < RANGE_LINES; i++) {
            String line = String.format("Line %03d: This is line number %03d with predictable content for range testing.",
                    i, i);
            builder.append(pad(line, RANGE_LINE_LENGTH - 1)).append('\n');
        }
        return builder.toString().getBytes(StandardCharsets.US_ASCII);
    }

    public static String utf8(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    private static String pad(String line, int width) {
        if (line.length() >= width) {
            return line.substring(0, width);
        }
        return line + " ".repeat(width - line.length());
    }
}
