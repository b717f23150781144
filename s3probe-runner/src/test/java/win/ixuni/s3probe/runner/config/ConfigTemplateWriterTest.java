package win.ixuni.s3probe.runner.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTemplateWriterTest {

    @TempDir
    Path dir;

    @Test
    void templateIsValidYaml() throws Exception {
        Path file = ConfigTemplateWriter.write(dir.resolve("conf/s3probe.yml"), false);

        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new FileSystemResource(file));
        Properties properties = yaml.getObject();

        assertNotNull(properties);
        assertEquals("s3", properties.getProperty("s3probe.gateway.type"));
        assertEquals("5242880", properties.getProperty("s3probe.test-data.multipart-chunk-size"));
        assertEquals("true", properties.getProperty("s3probe.checks.range_requests"));
    }

    @Test
    void existingFileIsKept() throws Exception {
        Path file = dir.resolve("s3probe.yml");
        Files.writeString(file, "keep: me");

        assertThrows(FileAlreadyExistsException.class, () -> ConfigTemplateWriter.write(file, false));
        assertEquals("keep: me", Files.readString(file));
    }
}
