package org.carball.dbml.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.dbml.config.ConfigurationLoader;
import org.carball.dbml.config.DbmlToolConfig;
import org.carball.dbml.generator.DbmlGenerator;
import org.carball.dbml.model.schema.Project;
import org.carball.dbml.parser.DdlSchemaParser;
import org.carball.dbml.serialization.ProjectSerializer;
import org.carball.dbml.validation.ValidationException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.Arrays;

@Slf4j
public class DbmlCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INVALID_SCHEMA = 2;

    private final ConfigurationLoader configurationLoader;
    private final PrintStream out;
    private final PrintStream err;

    public DbmlCLI(ConfigurationLoader configurationLoader, PrintStream out, PrintStream err) {
        this.configurationLoader = configurationLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new DbmlCLI(new ConfigurationLoader(), System.out, System.err).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? EXIT_ERROR : EXIT_OK;
        }

        try {
            DbmlToolConfig config = configurationLoader.loadConfiguration(args);
            Project project = loadProject(config);

            if (config.getDatabaseType() != null) {
                project.setDatabaseType(config.getDatabaseType());
            }

            if (config.isValidate()) {
                project.validate();
                if (config.isVerbose()) {
                    err.println("Schema is valid: " + project.getTables().size() + " tables, "
                            + project.getRefs().size() + " refs");
                }
            }

            String dbml = new DbmlGenerator().generate(project);

            if (config.getOutputFile() != null) {
                Files.writeString(config.getOutputFile(), dbml);
                log.info("Wrote DBML to {}", config.getOutputFile());
            } else {
                out.print(dbml);
            }
            return EXIT_OK;

        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (ValidationException e) {
            err.println("Invalid schema: " + e.getMessage());
            log.debug("Validation error details", e);
            return EXIT_INVALID_SCHEMA;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.error("Failed to convert schema", e);
            return EXIT_ERROR;
        }
    }

    private Project loadProject(DbmlToolConfig config) throws IOException {
        Project project;
        switch (config.getInputFormat()) {
            case SQL:
                return DdlSchemaParser.parseDdl(config.getInputFile(), config.getProjectName());
            case YAML:
                project = new ProjectSerializer().readYaml(config.getInputFile());
                break;
            case JSON:
            default:
                project = new ProjectSerializer().readJson(config.getInputFile());
                break;
        }
        if (project.getName() == null) {
            project.setName(config.getProjectName());
        }
        return project;
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("Usage: java -jar dbml-forge.jar <input-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  input-file          Schema document (.json, .yml/.yaml) or SQL DDL (.sql)");
        out.println();
        out.println("Options:");
        out.println("  --output, -o        Write DBML to this file (default: stdout)");
        out.println("  --format, -f        Input format: json|yaml|sql (default: from file extension)");
        out.println("  --project-name      Project name when the input does not carry one");
        out.println("  --database-type     Database type written to the Project block");
        out.println("  --no-validate       Generate without validating the schema first");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  java -jar dbml-forge.jar schema.yml -o schema.dbml");
        out.println("  java -jar dbml-forge.jar schema.sql --database-type PostgreSQL");
        out.println();
        out.print(ConfigurationLoader.getConfigurationHelp());
    }
}
