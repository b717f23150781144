package win.ixuni.s3probe.runner.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line switches of a probe run.
 * <p>
 * Spring properties ({@code --s3probe.*}) are bound separately and are not part of this.
 *
 * @param scopes          requested categories, empty for all
 * @param listScopes      print the categories and exit
 * @param exportFile      where to write the results, null for none
 * @param quiet           only warnings and the final verdict on the console
 * @param generateConfig  where to write a configuration template, null when not requested
 * @param overwriteConfig replace an existing template file
 */
public record RunOptions(List<String> scopes, boolean listScopes, String exportFile, boolean quiet,
                         String generateConfig, boolean overwriteConfig) {

    static final String DEFAULT_CONFIG_FILE = "s3probe.yml";

    public static RunOptions from(ApplicationArguments args) {
        List<String> scopes = new ArrayList<>();
        List<String> scopeValues = args.getOptionValues("scope");
        if (scopeValues != null) {
            for (String value : scopeValues) {
                for (String scope : value.split(",")) {
                    if (!scope.isBlank()) {
                        scopes.add(scope.trim());
                    }
                }
            }
        }
        String generateConfig = null;
        if (args.containsOption("generate-config")) {
            generateConfig = last(args.getOptionValues("generate-config"), DEFAULT_CONFIG_FILE);
        }
        return new RunOptions(
                List.copyOf(scopes),
                args.containsOption("list-scopes"),
                last(args.getOptionValues("export-results"), null),
                args.containsOption("quiet"),
                generateConfig,
                args.containsOption("overwrite-config"));
    }

    private static String last(List<String> values, String fallback) {
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            return fallback;
        }
        return values.get(values.size() - 1);
    }
}
