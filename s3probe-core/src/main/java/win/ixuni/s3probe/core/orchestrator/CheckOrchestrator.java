package win.ixuni.s3probe.core.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.s3probe.core.check.CategoryContext;
import win.ixuni.s3probe.core.check.CategoryDefinition;
import win.ixuni.s3probe.core.check.CategorySummary;
import win.ixuni.s3probe.core.check.CheckCategory;
import win.ixuni.s3probe.core.check.CheckResult;
import win.ixuni.s3probe.core.check.CleanupError;
import win.ixuni.s3probe.core.config.ProbeConfigValidator;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.exception.CategoryNotFoundException;
import win.ixuni.s3probe.core.exception.InitializationException;
import win.ixuni.s3probe.core.gateway.GatewayFactory;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.gateway.StorageGateway;
import win.ixuni.s3probe.core.model.BucketInfo;
import win.ixuni.s3probe.core.operation.bucket.ListBucketsOperation;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Selects, runs and aggregates check categories.
 * <p>
 * Categories run one at a time by default. With {@code s3probe.run.parallelism > 1} several run at
 * once on the bounded elastic scheduler; each still runs its probes in order and cleans up after its
 * last probe, and the summary is built once every category has finished. A category that throws is
 * recorded as a zero-result failure; the run itself always completes.
 */
@Slf4j
public class CheckOrchestrator implements AutoCloseable {

    public static final String ALL_SCOPES = "all";

    private final ProbeProperties properties;
    private final GatewayFactory gatewayFactory;
    private final Map<String, CategoryDefinition> catalog = new LinkedHashMap<>();
    private final Clock clock;

    private StorageGateway gateway;
    private RunSummary lastSummary;

    public CheckOrchestrator(ProbeProperties properties, GatewayFactory gatewayFactory,
                             List<CategoryDefinition> categories) {
        this(properties, gatewayFactory, categories, Clock.systemUTC());
    }

    public CheckOrchestrator(ProbeProperties properties, GatewayFactory gatewayFactory,
                             List<CategoryDefinition> categories, Clock clock) {
        this.properties = properties;
        this.gatewayFactory = gatewayFactory;
        this.clock = clock;
        for (CategoryDefinition definition : categories) {
            catalog.put(definition.getName(), definition);
        }
    }

    /**
     * Validate the configuration, build the gateway and check that the endpoint answers.
     *
     * @throws InitializationException when any step fails
     */
    public void initialize() {
        ProbeConfigValidator.Report report = ProbeConfigValidator.validate(properties, catalog.keySet());
        report.warnings().forEach(warning -> log.warn("Configuration warning: {}", warning));
        if (!report.isValid()) {
            throw new InitializationException("Invalid configuration: " + String.join("; ", report.errors()));
        }

        try {
            gateway = gatewayFactory.createGateway(properties);
        } catch (RuntimeException e) {
            throw new InitializationException("Failed to create " + gatewayFactory.getGatewayType()
                    + " gateway: " + e.getMessage(), e);
        }

        GatewayResult<List<BucketInfo>> buckets = gateway.listBuckets(new ListBucketsOperation());
        if (buckets.isFailure()) {
            throw new InitializationException("Connection test failed: " + buckets.getError().describe());
        }
        log.info("Connection test passed, {} buckets visible", buckets.getValue().size());
        log.info("Available check categories: {}", catalog.keySet());
    }

    public boolean isInitialized() {
        return gateway != null;
    }

    public List<CategoryDefinition> getCategories() {
        return List.copyOf(catalog.values());
    }

    public CategoryDefinition getCategory(String name) {
        CategoryDefinition definition = catalog.get(name);
        if (definition == null) {
            throw new CategoryNotFoundException(name);
        }
        return definition;
    }

    /**
     * Enabled categories matching the requested scopes, in catalog order.
     * {@code "all"} (or no scope) means every enabled category; unknown names are logged and skipped.
     */
    public List<CategoryDefinition> resolveScopes(Collection<String> scopes) {
        Set<String> requested = new LinkedHashSet<>();
        for (String scope : scopes) {
            requested.add(scope.trim().toLowerCase(Locale.ROOT));
        }
        boolean all = requested.isEmpty() || requested.contains(ALL_SCOPES);
        if (!all) {
            for (String scope : requested) {
                if (!catalog.containsKey(scope)) {
                    log.warn("Unknown check category '{}', skipping", scope);
                } else if (!properties.isCategoryEnabled(scope)) {
                    log.warn("Check category '{}' is disabled in configuration, skipping", scope);
                }
            }
        }
        List<CategoryDefinition> selected = new ArrayList<>();
        for (CategoryDefinition definition : catalog.values()) {
            String name = definition.getName();
            if (properties.isCategoryEnabled(name) && (all || requested.contains(name))) {
                selected.add(definition);
            }
        }
        return selected;
    }

    /**
     * Run the selected categories and aggregate their results
     *
     * @param scopes category names, or "all"
     * @return summary of this run, also kept as {@link #getSummary()}
     */
    public RunSummary runChecks(Collection<String> scopes) {
        if (gateway == null) {
            throw new IllegalStateException("Orchestrator not initialized");
        }
        List<CategoryDefinition> selected = resolveScopes(scopes);
        int parallelism = Math.max(1, properties.getRun().getParallelism());
        log.info("Running {} check categories {} (parallelism {})",
                selected.size(), selected.stream().map(CategoryDefinition::getName).toList(), parallelism);

        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(properties.getTimeouts().getRunDeadline());

        List<CategoryResult> results = Flux.fromIterable(selected)
                .flatMapSequential(definition -> Mono.fromCallable(() -> runCategory(definition, deadline))
                        .subscribeOn(Schedulers.boundedElastic()), parallelism)
                .collectList()
                .block();

        lastSummary = RunSummary.of(results != null ? results : List.of(), startedAt, clock.instant());
        log.info("Run finished: {}/{} checks passed ({}%) in {}s",
                lastSummary.getTotalPassed(), lastSummary.getTotalChecks(),
                String.format(Locale.ROOT, "%.1f", lastSummary.getOverallSuccessRate()),
                String.format(Locale.ROOT, "%.2f", lastSummary.getOverallDuration()));
        return lastSummary;
    }

    /**
     * Runs one category end to end. Never throws.
     */
    CategoryResult runCategory(CategoryDefinition definition, Instant deadline) {
        String name = definition.getName();
        log.info("Running {} checks...", name);
        long start = System.nanoTime();

        CheckCategory category;
        try {
            CategoryContext context = CategoryContext.builder()
                    .gateway(gateway)
                    .testData(properties.getTestData())
                    .logger(LoggerFactory.getLogger("s3probe.check." + name))
                    .deadline(deadline)
                    .clock(clock)
                    .build();
            category = definition.getFactory().create(context);
        } catch (RuntimeException e) {
            log.error("Failed to create check category {}", name, e);
            return CategoryResult.faulted(name, "Failed to create category: " + e.getMessage(), seconds(start));
        }

        List<CheckResult> results;
        try {
            results = category.runChecks();
        } catch (RuntimeException e) {
            log.error("Check category {} failed outside probe isolation", name, e);
            List<CleanupError> cleanupErrors = runCleanup(category);
            return CategoryResult.builder()
                    .category(name)
                    .summary(CategorySummary.empty(name))
                    .duration(seconds(start))
                    .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .cleanupErrors(cleanupErrors)
                    .build();
        }

        List<CleanupError> cleanupErrors = runCleanup(category);
        CategoryResult result = CategoryResult.builder()
                .category(name)
                .summary(category.getSummary())
                .results(List.copyOf(results))
                .duration(seconds(start))
                .cleanupErrors(cleanupErrors)
                .build();
        log.info("Completed {} checks: {}/{} passed", name,
                result.getSummary().getPassed(), result.getSummary().getTotal());
        return result;
    }

    private List<CleanupError> runCleanup(CheckCategory category) {
        if (!properties.getTestData().isCleanupEnabled()) {
            log.info("Cleanup disabled, leaving resources of {} in place", category.getName());
            return List.of();
        }
        try {
            return category.cleanup();
        } catch (RuntimeException e) {
            log.warn("Cleanup of {} failed: {}", category.getName(), e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * Failing checks of the last run, flattened with their category
     */
    public List<FailedCheck> getFailedChecks() {
        return lastSummary != null ? lastSummary.failedChecks() : List.of();
    }

    public RunSummary getSummary() {
        return lastSummary;
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    @Override
    public void close() {
        if (gateway != null) {
            try {
                gateway.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close gateway: {}", e.getMessage());
            }
        }
    }
}
