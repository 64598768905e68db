package org.pragmatica.urlkit.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported configuration file formats.
 */
public enum ConfigFormat {
    JSON,
    YAML;

    /**
     * Detect the format from the file extension: {@code .json}, {@code .yaml} or {@code .yml}.
     */
    public static Optional<ConfigFormat> fromPath(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        var name = fileName.toString()
                           .toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return Optional.of(JSON);
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return Optional.of(YAML);
        }
        return Optional.empty();
    }
}
