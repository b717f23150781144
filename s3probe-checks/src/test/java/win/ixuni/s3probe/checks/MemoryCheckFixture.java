package win.ixuni.s3probe.checks;

import org.slf4j.LoggerFactory;
import win.ixuni.s3probe.core.check.CategoryContext;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Shared setup for running categories against the in-memory gateway
 */
public final class MemoryCheckFixture {

    private MemoryCheckFixture() {
    }

    public static MemoryStorageGateway newGateway() {
        return new MemoryStorageGateway("checks-test");
    }

    /**
     * Test data sized down where the probes allow it. The part size stays at the 5 MiB minimum the
     * memory gateway enforces.
     */
    public static ProbeProperties.TestDataConfig testData() {
        ProbeProperties.TestDataConfig testData = new ProbeProperties.TestDataConfig();
        testData.setSmallFileSize(1024);
        testData.setMediumFileSize(64 * 1024);
        testData.setBucketPrefix("probe-test");
        return testData;
    }

    public static CategoryContext context(StorageGateway gateway, String category) {
        return context(gateway, category, null);
    }

    public static CategoryContext context(StorageGateway gateway, String category, Instant deadline) {
        return CategoryContext.builder()
                .gateway(gateway)
                .testData(testData())
                .logger(LoggerFactory.getLogger("s3probe.check." + category))
                .deadline(deadline)
                .build();
    }

    public static Optional<CheckResult> find(List<CheckResult> results, String name) {
        return results.stream().filter(result -> result.getName().equals(name)).findFirst();
    }

    /**
     * @throws AssertionError when the result is missing or failed, with its message
     */
    public static void assertPassed(List<CheckResult> results, String name) {
        CheckResult result = find(results, name)
                .orElseThrow(() -> new AssertionError("No result named " + name + " in "
                        + results.stream().map(CheckResult::getName).toList()));
        if (!result.isSuccess()) {
            throw new AssertionError(name + " failed: " + result.getMessage() + " " + result.getDetails());
        }
    }

    public static void assertFailed(List<CheckResult> results, String name) {
        CheckResult result = find(results, name)
                .orElseThrow(() -> new AssertionError("No result named " + name));
        if (result.isSuccess()) {
            throw new AssertionError(name + " passed unexpectedly: " + result.getMessage());
        }
    }
}
