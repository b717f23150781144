package win.ixuni.s3probe.runner.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the annotated configuration template, to be edited and passed with
 * {@code --spring.config.additional-location}.
 */
@Slf4j
public final class ConfigTemplateWriter {

    static final String TEMPLATE = "s3probe-template.yml";

    private ConfigTemplateWriter() {
    }

    /**
     * @throws FileAlreadyExistsException when the file exists and {@code overwrite} is false
     */
    public static Path write(Path target, boolean overwrite) throws FileAlreadyExistsException {
        if (Files.exists(target) && !overwrite) {
            throw new FileAlreadyExistsException(target.toString(), null, "configuration file already exists");
        }
        try (InputStream template = new ClassPathResource(TEMPLATE).getInputStream()) {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(template, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration template to " + target, e);
        }
        log.info("Configuration template written to {}", target);
        return target;
    }
}
