package org.pragmatica.urlkit.config;

import org.pragmatica.urlkit.UrlKitError;

import java.util.List;

/**
 * Configuration loading errors.
 */
public sealed interface ConfigError extends UrlKitError {

    record ParseFailed(String source, String detail) implements ConfigError {
        @Override
        public String message() {
            return "Failed to parse route configuration from " + source + ": " + detail;
        }
    }

    record InvalidConfig(String reason) implements ConfigError {
        @Override
        public String message() {
            return "Invalid route configuration: " + reason;
        }
    }

    record ValidationFailed(List<String> errors) implements ConfigError {
        public ValidationFailed {
            errors = List.copyOf(errors);
        }

        @Override
        public String message() {
            return "Route configuration validation failed:\n- " + String.join("\n- ", errors);
        }
    }

    static ConfigError validationFailed(List<String> errors) {
        return new ValidationFailed(errors);
    }
}
