package win.ixuni.s3probe.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import win.ixuni.s3probe.core.config.ProbeProperties;

/**
 * S3Probe launcher
 * <p>
 * Runs the selected check categories once and exits with the run's exit code.
 */
@SpringBootApplication
@EnableConfigurationProperties(ProbeProperties.class)
public class S3ProbeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(S3ProbeApplication.class, args)));
    }
}
