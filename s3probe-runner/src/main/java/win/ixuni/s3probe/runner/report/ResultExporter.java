package win.ixuni.s3probe.runner.report;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3probe.core.orchestrator.RunSummary;
import win.ixuni.s3probe.core.util.JsonUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes a run to a file: JSON for a {@code .json} name, the text report otherwise
 */
@Slf4j
public final class ResultExporter {

    private ResultExporter() {
    }

    public static Path export(RunSummary summary, Path target) {
        Path parent = target.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                if (isJson(target)) {
                    JsonUtils.writeJson(writer, summary);
                } else {
                    writer.write(TextReportFormatter.format(summary));
                    writer.write('\n');
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export results to " + target, e);
        }
        log.info("Results exported to {}", target);
        return target;
    }

    static boolean isJson(Path target) {
        return target.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
