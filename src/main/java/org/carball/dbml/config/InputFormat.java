package org.carball.dbml.config;

import java.nio.file.Path;
import java.util.Locale;

public enum InputFormat {
    JSON,
    YAML,
    SQL;

    /**
     * Infers the format from a file extension, or returns {@code null} when it is not recognized.
     */
    public static InputFormat fromFileName(Path file) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return JSON;
        } else if (fileName.endsWith(".yml") || fileName.endsWith(".yaml")) {
            return YAML;
        } else if (fileName.endsWith(".sql") || fileName.endsWith(".ddl")) {
            return SQL;
        }
        return null;
    }

    public static InputFormat fromName(String name) {
        try {
            return InputFormat.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid input format: " + name + ". Use: json, yaml, or sql", e);
        }
    }
}
