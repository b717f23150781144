package win.ixuni.s3probe.runner.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import win.ixuni.s3probe.checks.CheckCatalog;
import win.ixuni.s3probe.core.check.CategoryDefinition;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.exception.ProbeException;
import win.ixuni.s3probe.core.gateway.GatewayFactory;
import win.ixuni.s3probe.core.orchestrator.CheckOrchestrator;
import win.ixuni.s3probe.core.orchestrator.RunSummary;
import win.ixuni.s3probe.runner.config.ConfigTemplateWriter;
import win.ixuni.s3probe.runner.registry.GatewayFactoryRegistry;
import win.ixuni.s3probe.runner.report.ResultExporter;
import win.ixuni.s3probe.runner.report.TextReportFormatter;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point of a probe run.
 * <p>
 * Handles the informational switches, runs the selected categories against the configured gateway,
 * prints the report and remembers the exit code for {@link org.springframework.boot.SpringApplication#exit}.
 */
@Slf4j
@Component
public class ProbeCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CHECKS_FAILED = 1;
    public static final int EXIT_INITIALIZATION_FAILED = 2;

    private static final String[] QUIET_LOGGERS = {LoggingSystem.ROOT_LOGGER_NAME, "win.ixuni.s3probe", "s3probe"};

    private final ProbeProperties properties;
    private final GatewayFactoryRegistry gatewayRegistry;
    private final List<CategoryDefinition> categories;
    private final LoggingSystem loggingSystem;
    private final PrintStream out;

    private volatile int exitCode = EXIT_OK;
    private volatile RunSummary lastSummary;

    @Autowired
    public ProbeCommandLineRunner(ProbeProperties properties, GatewayFactoryRegistry gatewayRegistry,
                                  LoggingSystem loggingSystem) {
        this(properties, gatewayRegistry, CheckCatalog.categories(), loggingSystem, System.out);
    }

    ProbeCommandLineRunner(ProbeProperties properties, GatewayFactoryRegistry gatewayRegistry,
                           List<CategoryDefinition> categories, LoggingSystem loggingSystem, PrintStream out) {
        this.properties = properties;
        this.gatewayRegistry = gatewayRegistry;
        this.categories = categories;
        this.loggingSystem = loggingSystem;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunOptions options = RunOptions.from(args);
        if (options.quiet()) {
            for (String logger : QUIET_LOGGERS) {
                loggingSystem.setLogLevel(logger, LogLevel.WARN);
            }
        }
        if (options.generateConfig() != null) {
            exitCode = generateConfig(options);
            return;
        }
        if (options.listScopes()) {
            listScopes();
            exitCode = EXIT_OK;
            return;
        }
        exitCode = runChecks(options);
    }

    private int runChecks(RunOptions options) {
        GatewayFactory factory;
        try {
            factory = gatewayRegistry.resolve(properties.getGateway().getType());
        } catch (ProbeException e) {
            log.error("Initialization failed: {}", e.getMessage());
            out.println("✗ Initialization failed: " + e.getMessage());
            return EXIT_INITIALIZATION_FAILED;
        }

        try (CheckOrchestrator orchestrator = new CheckOrchestrator(properties, factory, categories)) {
            try {
                orchestrator.initialize();
            } catch (ProbeException e) {
                log.error("Initialization failed: {}", e.getMessage(), e.getCause());
                out.println("✗ Initialization failed: " + e.getMessage());
                return EXIT_INITIALIZATION_FAILED;
            }

            List<CategoryDefinition> selected = orchestrator.resolveScopes(options.scopes());
            if (selected.isEmpty()) {
                out.println("✗ No valid check scopes specified");
                return EXIT_INITIALIZATION_FAILED;
            }
            if (!options.quiet()) {
                out.println("Running checks: " + String.join(", ",
                        selected.stream().map(CategoryDefinition::getName).toList()));
                out.println();
            }

            RunSummary summary = orchestrator.runChecks(options.scopes());
            lastSummary = summary;
            if (!options.quiet()) {
                out.println();
                out.println(TextReportFormatter.format(summary));
            }
            out.println(TextReportFormatter.verdict(summary));

            if (options.exportFile() != null) {
                try {
                    Path exported = ResultExporter.export(summary, Path.of(options.exportFile()));
                    out.println("Results exported to " + exported);
                } catch (UncheckedIOException e) {
                    log.error("Export failed: {}", e.getMessage(), e);
                    out.println("✗ " + e.getMessage());
                }
            }
            return summary.isAllPassed() ? EXIT_OK : EXIT_CHECKS_FAILED;
        }
    }

    private void listScopes() {
        out.println("Available check scopes:");
        out.println();
        for (CategoryDefinition category : categories) {
            String disabled = properties.isCategoryEnabled(category.getName()) ? "" : " (disabled)";
            out.printf("  %-20s - %s%s%n", category.getName(), category.getDescription(), disabled);
        }
        out.printf("  %-20s - %s%n", CheckOrchestrator.ALL_SCOPES, "Every enabled category");
        out.println();
        out.println("Usage examples:");
        out.println("  --scope=all");
        out.println("  --scope=buckets,objects");
        out.println("  --scope=range_requests,error_conditions --export-results=results.json");
    }

    private int generateConfig(RunOptions options) {
        Path target = Path.of(options.generateConfig());
        try {
            ConfigTemplateWriter.write(target, options.overwriteConfig());
        } catch (FileAlreadyExistsException e) {
            out.println("✗ " + target + " already exists, use --overwrite-config to replace it");
            return EXIT_INITIALIZATION_FAILED;
        } catch (UncheckedIOException e) {
            log.error("Failed to generate configuration template", e);
            out.println("✗ " + e.getMessage());
            return EXIT_INITIALIZATION_FAILED;
        }
        out.println("✓ Configuration template generated: " + target);
        out.println();
        out.println("Next steps:");
        out.println("1. Edit " + target + " with your S3 endpoint details");
        out.println("2. Run checks: --spring.config.additional-location=file:" + target + " --scope=all");
        return EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Summary of the last run, null when no checks ran
     */
    public RunSummary getLastSummary() {
        return lastSummary;
    }
}
