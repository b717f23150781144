package win.ixuni.s3probe.gateway.memory.handler.object;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import win.ixuni.s3probe.core.exception.GatewayException;

import static org.junit.jupiter.api.Assertions.*;

class ByteRangeTest {

    @ParameterizedTest
    @CsvSource({
            "bytes=0-99, 0, 99",
            "bytes=9990-, 9990, 9999",
            "bytes=-100, 9900, 9999",
            "bytes=0-999999, 0, 9999",
            "bytes=-20000, 0, 9999"
    })
    void satisfiable(String header, long start, long end) {
        ByteRange range = ByteRange.resolve(header, 10_000);

        assertEquals(start, range.start());
        assertEquals(end, range.end());
        assertEquals("bytes " + start + "-" + end + "/10000", range.contentRange());
    }

    @ParameterizedTest
    @ValueSource(strings = {"bytes=0-10,20-30", "bytes=abc-def", "items=0-10", "bytes=-", "bytes=100-50"})
    @DisplayName("Unparseable and multi-range headers fall back to the whole object")
    void ignored(String header) {
        assertNull(ByteRange.resolve(header, 10_000));
    }

    @Test
    void unsatisfiable() {
        GatewayException e = assertThrows(GatewayException.class, () -> ByteRange.resolve("bytes=10000-", 10_000));

        assertEquals(416, e.getHttpStatus());
        assertEquals("InvalidRange", e.getErrorCode());
        assertThrows(GatewayException.class, () -> ByteRange.resolve("bytes=-0", 10_000));
    }

    @Test
    void absentHeader() {
        assertNull(ByteRange.resolve(null, 10));
    }
}
