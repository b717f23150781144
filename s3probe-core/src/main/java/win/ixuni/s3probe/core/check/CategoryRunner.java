package win.ixuni.s3probe.core.check;

import org.slf4j.Logger;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.exception.ProbeException;
import win.ixuni.s3probe.core.gateway.GatewayError;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing of a category run, held by each category: the ledger, the cleanup registry, the
 * scoped bucket and the probe isolation boundary.
 * <p>
 * Typical use:
 * <pre>
 * if (!runner.provisionBucket()) {
 *     return runner.getResults();
 * }
 * runner.probe("object_download", this::checkDownload);
 * return runner.getResults();
 * </pre>
 */
public class CategoryRunner {

    private final String category;
    private final CategoryContext context;
    private final Logger log;
    private final ResultLedger ledger;
    private final CleanupRegistry cleanupRegistry;

    private CategoryState state = CategoryState.UNINITIALIZED;
    private String bucketName;
    private long lastNameMillis;

    public CategoryRunner(String category, CategoryContext context) {
        this.category = category;
        this.context = context;
        this.log = context.getLogger();
        this.ledger = new ResultLedger(category);
        this.cleanupRegistry = new CleanupRegistry(context.getGateway(), context.getLogger());
    }

    public String getCategory() {
        return category;
    }

    public StorageGateway getGateway() {
        return context.getGateway();
    }

    public Logger getLogger() {
        return log;
    }

    public ProbeProperties.TestDataConfig getTestData() {
        return context.getTestData();
    }

    public CategoryState getState() {
        return state;
    }

    /**
     * Name of the scoped bucket, null before provisioning
     */
    public String getBucketName() {
        return bucketName;
    }

    public List<CheckResult> getResults() {
        return ledger.getResults();
    }

    public CategorySummary getSummary() {
        return ledger.summarize();
    }

    public CleanupRegistry getCleanupRegistry() {
        return cleanupRegistry;
    }

    // ==================== Lifecycle ====================

    /**
     * Create the scoped bucket of this run and queue it for cleanup.
     * On failure a single {@code <category>_bucket_setup} failure is recorded.
     *
     * @return true when probes may run
     */
    public boolean provisionBucket() {
        if (state != CategoryState.UNINITIALIZED) {
            throw new IllegalStateException("Bucket already provisioned for category " + category);
        }
        long start = startTimer();
        String name = generateUniqueName(bucketPrefix());
        GatewayResult<Void> created = getGateway().createBucket(new CreateBucketOperation(name));
        if (created.isFailure()) {
            state = CategoryState.DONE_WITH_PARTIAL_RESULTS;
            failWithError(category + "_bucket_setup",
                    "Failed to create test bucket " + name, created.getError(), start);
            return false;
        }
        bucketName = name;
        addCleanupItem(CleanupItem.bucket(name));
        state = CategoryState.BUCKET_PROVISIONED;
        log.info("Created test bucket: {}", name);
        return true;
    }

    /**
     * Run one probe behind the isolation boundary. Any exception escaping {@code body} becomes a
     * single failing result named {@code name}; later probes still run.
     *
     * @throws IllegalStateException when the scoped bucket was never provisioned
     */
    public void probe(String name, Runnable body) {
        if (state != CategoryState.BUCKET_PROVISIONED && state != CategoryState.PROBING) {
            throw new IllegalStateException("Category " + category + " cannot probe in state " + state);
        }
        state = CategoryState.PROBING;

        Instant deadline = context.getDeadline();
        if (deadline != null && context.getClock().instant().isAfter(deadline)) {
            fail(name, "Run deadline exceeded, probe not started", Map.of("deadline", deadline.toString()), 0.0);
            return;
        }

        long start = startTimer();
        try {
            body.run();
        } catch (RuntimeException e) {
            log.error("Probe {} raised an unexpected error", name, e);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exception", e.getClass().getName());
            if (e instanceof ProbeException probeException) {
                details.put("error_code", probeException.getErrorCode());
                details.put("http_status", probeException.getHttpStatus());
            }
            fail(name, "Probe raised an unexpected error: " + e.getMessage(), details, secondsSince(start));
        }
    }

    /**
     * Drain the cleanup registry. Safe to call more than once.
     */
    public List<CleanupError> cleanup() {
        boolean provisioned = bucketName != null;
        if (state != CategoryState.DONE_WITH_PARTIAL_RESULTS) {
            state = CategoryState.CLEANING;
        }
        List<CleanupError> errors = cleanupRegistry.drain();
        if (!errors.isEmpty()) {
            log.warn("{} resources of category {} could not be cleaned up", errors.size(), category);
        }
        state = provisioned ? CategoryState.DONE : CategoryState.DONE_WITH_PARTIAL_RESULTS;
        return errors;
    }

    // ==================== Results ====================

    public CheckResult addResult(String name, boolean success, String message,
                                 Map<String, Object> details, double duration) {
        CheckResult result = new CheckResult(name, success, message, details, duration,
                context.getClock().instant());
        ledger.append(result);
        if (success) {
            log.info("✓ {}: {}", name, message);
        } else {
            log.warn("✗ {}: {}", name, message);
        }
        return result;
    }

    public CheckResult pass(String name, String message, Map<String, Object> details, double duration) {
        return addResult(name, true, message, details, duration);
    }

    public CheckResult fail(String name, String message, Map<String, Object> details, double duration) {
        return addResult(name, false, message, details, duration);
    }

    public CheckResult pass(String name, String message, Map<String, Object> details, long startNanos) {
        return pass(name, message, details, secondsSince(startNanos));
    }

    public CheckResult fail(String name, String message, Map<String, Object> details, long startNanos) {
        return fail(name, message, details, secondsSince(startNanos));
    }

    /**
     * Record a failure caused by an unexpected gateway error, with code and status in the details
     */
    public CheckResult failWithError(String name, String message, GatewayError error, long startNanos) {
        return fail(name, message + ": " + error.describe(), errorDetails(error), startNanos);
    }

    /**
     * Record an expected-rejection outcome: pass iff the operation failed with one of {@code accepted}.
     * An unexpected success fails.
     */
    public CheckResult expectRejection(String name, String scenario, GatewayResult<?> result,
                                       long startNanos, int... accepted) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scenario", scenario);
        details.put("expected_status", CheckPolicies.describe(accepted));
        if (result.isSuccess()) {
            details.put("unexpected_success", true);
            return fail(name, scenario + " should have been rejected but succeeded", details, startNanos);
        }
        GatewayError error = result.getError();
        details.putAll(errorDetails(error));
        if (error.hasStatus(accepted)) {
            return pass(name, scenario + " correctly rejected with " + error.getCode()
                    + " (" + error.getHttpStatus() + ")", details, startNanos);
        }
        return fail(name, scenario + " rejected with unexpected status " + error.getHttpStatus()
                + " (" + error.getCode() + "), expected " + CheckPolicies.describe(accepted), details, startNanos);
    }

    public static Map<String, Object> errorDetails(GatewayError error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_code", error.getCode());
        details.put("http_status", error.getHttpStatus());
        details.put("error_message", error.getMessage());
        return details;
    }

    // ==================== Cleanup items ====================

    /**
     * Queue a resource for cleanup. Call only after the gateway confirmed its creation.
     */
    public void addCleanupItem(CleanupItem item) {
        cleanupRegistry.register(item);
    }

    public boolean forgetCleanupItem(CleanupItem item) {
        return cleanupRegistry.forget(item);
    }

    // ==================== Naming and timing ====================

    /**
     * {@code {prefix}-{millis}}, strictly increasing within this runner so that two calls in the same
     * millisecond still get distinct names
     */
    public String generateUniqueName(String prefix) {
        long millis = context.getClock().millis();
        if (millis <= lastNameMillis) {
            millis = lastNameMillis + 1;
        }
        lastNameMillis = millis;
        return prefix + "-" + millis;
    }

    public String generateUniqueName() {
        return generateUniqueName(bucketPrefix());
    }

    private String bucketPrefix() {
        String prefix = getTestData() != null ? getTestData().getBucketPrefix() : "s3probe";
        return prefix + "-" + category.replace('_', '-');
    }

    public static long startTimer() {
        return System.nanoTime();
    }

    public static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
