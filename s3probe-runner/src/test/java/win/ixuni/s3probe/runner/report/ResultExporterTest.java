package win.ixuni.s3probe.runner.report;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import win.ixuni.s3probe.core.util.JsonUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ResultExporterTest {

    @TempDir
    Path dir;

    @Test
    void json() throws Exception {
        Path file = ResultExporter.export(TextReportFormatterTest.sampleSummary(), dir.resolve("out/RESULTS.JSON"));

        JsonNode json = JsonUtils.mapper().readTree(file.toFile());
        assertEquals(3, json.get("totalChecks").asInt());
        assertEquals(1, json.get("totalFailed").asInt());
        assertEquals("2024-05-01T10:00:00Z", json.get("startedAt").asText());
        assertEquals("object_download",
                json.get("results").get("objects").get("results").get(1).get("name").asText());
    }

    @Test
    void textForOtherExtensions() throws Exception {
        Path file = ResultExporter.export(TextReportFormatterTest.sampleSummary(), dir.resolve("results.txt"));

        assertTrue(Files.readString(file).startsWith("=".repeat(60)));
        assertFalse(ResultExporter.isJson(file));
    }
}
