package org.carball.dbml.config;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_FORMAT = "DBML_FORGE_FORMAT";
    static final String ENV_OUTPUT = "DBML_FORGE_OUTPUT";
    static final String ENV_DATABASE_TYPE = "DBML_FORGE_DATABASE_TYPE";
    static final String ENV_SKIP_VALIDATION = "DBML_FORGE_SKIP_VALIDATION";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public DbmlToolConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        if (args.length == 0 || args[0].startsWith("-")) {
            throw new IllegalArgumentException("Input file not specified");
        }

        DbmlToolConfig.DbmlToolConfigBuilder builder = DbmlToolConfig.builder()
                .inputFile(Paths.get(args[0]));

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        DbmlToolConfig config = builder.build();
        if (config.getInputFormat() == null) {
            config.setInputFormat(InputFormat.fromFileName(config.getInputFile()));
        }
        if (config.getProjectName() == null) {
            config.setProjectName(baseName(config.getInputFile()));
        }
        validate(config);

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(DbmlToolConfig.DbmlToolConfigBuilder builder) {
        if (environment.containsKey(ENV_FORMAT)) {
            try {
                builder.inputFormat(InputFormat.fromName(environment.get(ENV_FORMAT)));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring {}: {}", ENV_FORMAT, e.getMessage());
            }
        }
        if (environment.containsKey(ENV_OUTPUT)) {
            builder.outputFile(Paths.get(environment.get(ENV_OUTPUT)));
        }
        if (environment.containsKey(ENV_DATABASE_TYPE)) {
            builder.databaseType(environment.get(ENV_DATABASE_TYPE));
        }
        if (environment.containsKey(ENV_SKIP_VALIDATION)) {
            builder.validate(!Boolean.parseBoolean(environment.get(ENV_SKIP_VALIDATION)));
        }
    }

    private void applyCLIArguments(DbmlToolConfig.DbmlToolConfigBuilder builder, String[] args) {
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    builder.outputFile(Paths.get(requireValue(args, i++, "Output file")));
                    break;

                case "--format":
                case "-f":
                    builder.inputFormat(InputFormat.fromName(requireValue(args, i++, "Input format")));
                    break;

                case "--project-name":
                    builder.projectName(requireValue(args, i++, "Project name"));
                    break;

                case "--database-type":
                    builder.databaseType(requireValue(args, i++, "Database type"));
                    break;

                case "--no-validate":
                    builder.validate(false);
                    break;

                case "--verbose":
                case "-v":
                    builder.verbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
    }

    private static String requireValue(String[] args, int optionIndex, String description) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(description + " not specified");
        }
        return args[optionIndex + 1];
    }

    private static void validate(DbmlToolConfig config) {
        if (!Files.exists(config.getInputFile())) {
            throw new IllegalArgumentException("Input file not found: " + config.getInputFile());
        }
        if (config.getInputFormat() == null) {
            throw new IllegalArgumentException(
                    "Cannot infer input format from " + config.getInputFile() + ". Use --format json|yaml|sql");
        }
        Path outputDir = config.getOutputFile() != null ? config.getOutputFile().toAbsolutePath().getParent() : null;
        if (outputDir != null && !Files.isDirectory(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int lastDotIndex = fileName.lastIndexOf('.');
        return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Environment Variables:
              DBML_FORGE_FORMAT            Same as --format
              DBML_FORGE_OUTPUT            Same as --output
              DBML_FORGE_DATABASE_TYPE     Same as --database-type
              DBML_FORGE_SKIP_VALIDATION   'true' is the same as --no-validate

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults (format inferred from the file extension)
            """;
    }
}
