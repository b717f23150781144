package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.exception.GatewayException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single byte range resolved against an object length, following S3: syntactically invalid and
 * multi-range headers are ignored, unsatisfiable ones are rejected with 416.
 */
record ByteRange(long start, long end, long total) {

    private static final Pattern SINGLE_RANGE = Pattern.compile("^bytes=(\\d*)-(\\d*)$");

    /**
     * @return the resolved range, or null when the whole object should be returned
     * @throws GatewayException InvalidRange when the range cannot be satisfied
     */
    static ByteRange resolve(String header, long length) {
        if (header == null) {
            return null;
        }
        Matcher matcher = SINGLE_RANGE.matcher(header.trim());
        if (!matcher.matches()) {
            return null;
        }
        String first = matcher.group(1);
        String last = matcher.group(2);
        if (first.isEmpty() && last.isEmpty()) {
            return null;
        }
        try {
            if (first.isEmpty()) {
                long suffix = Long.parseLong(last);
                if (suffix == 0 || length == 0) {
                    throw unsatisfiable(length);
                }
                return new ByteRange(Math.max(0, length - suffix), length - 1, length);
            }
            long start = Long.parseLong(first);
            long end = last.isEmpty() ? length - 1 : Long.parseLong(last);
            if (end < start) {
                return null;
            }
            if (start >= length) {
                throw unsatisfiable(length);
            }
            return new ByteRange(start, Math.min(end, length - 1), length);
        } catch (NumberFormatException e) {
            // Beyond long range, treat like any other unparseable header
            return null;
        }
    }

    private static GatewayException unsatisfiable(long length) {
        return new GatewayException("InvalidRange", "The requested range is not satisfiable (object size "
                + length + ")", 416);
    }

    int length() {
        return (int) (end - start + 1);
    }

    String contentRange() {
        return "bytes " + start + "-" + end + "/" + total;
    }
}
