package win.ixuni.s3probe.runner;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.runner.cli.ProbeCommandLineRunner;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(args = "--list-scopes", properties = {
        "s3probe.gateway.type=memory",
        "s3probe.checks.sync=false",
        "s3probe.timeouts.run-deadline=5m"
})
class S3ProbeApplicationTest {

    @Autowired
    private ProbeProperties properties;

    @Autowired
    private ProbeCommandLineRunner runner;

    @Test
    void bindsPropertiesAndListsScopes() {
        assertEquals("memory", properties.getGateway().getType());
        assertFalse(properties.isCategoryEnabled("sync"));
        assertEquals(Duration.ofMinutes(5), properties.getTimeouts().getRunDeadline());
        assertEquals(ProbeCommandLineRunner.EXIT_OK, runner.getExitCode());
        assertNull(runner.getLastSummary());
    }
}
