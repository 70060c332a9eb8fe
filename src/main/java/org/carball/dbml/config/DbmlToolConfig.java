package org.carball.dbml.config;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder(toBuilder = true)
public class DbmlToolConfig {
    private Path inputFile;
    private InputFormat inputFormat;
    // null writes to stdout
    private Path outputFile;
    private String projectName;
    private String databaseType;

    @Builder.Default
    private boolean validate = true;

    private boolean verbose;

    public String getConfigurationSummary() {
        return String.format("Input: %s (%s) | Output: %s | Validate: %s",
                inputFile, inputFormat, outputFile != null ? outputFile : "stdout", validate);
    }
}
