package org.pragmatica.urlkit.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.pragmatica.urlkit.RouteManager;
import org.pragmatica.urlkit.UrlKitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads route configuration from JSON or YAML.
 *
 * <p>Unknown properties are ignored. Loaded configuration is always validated with
 * {@link ConfigValidator} before it is returned.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private ConfigLoader() {}

    /**
     * Load configuration from a file; the format follows the file extension.
     */
    public static RouteConfig load(Path path) throws UrlKitException {
        var format = ConfigFormat.fromPath(path)
                                 .orElseThrow(() -> new ConfigError.InvalidConfig("unsupported configuration file extension: " + path)
                                                                    .exception());
        return load(path, format);
    }

    /**
     * Load configuration from a file in the given format.
     */
    public static RouteConfig load(Path path, ConfigFormat format) throws UrlKitException {
        String content;
        try{
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigError.ParseFailed(path.toString(), "cannot read file: " + e.getMessage()).exception();
        }
        var config = parse(content, format, path.toString());
        log.info("Loaded {} root group(s) from {}",
                 config.groups()
                       .size(),
                 path);
        return config;
    }

    /**
     * Load configuration from string content.
     */
    public static RouteConfig loadFromString(String content, ConfigFormat format) throws UrlKitException {
        return parse(content, format, "<string>");
    }

    /**
     * Load configuration from a file and build a route manager from it.
     */
    public static RouteManager loadManager(Path path) throws UrlKitException {
        return RouteManagerFactory.fromConfig(load(path));
    }

    private static RouteConfig parse(String content, ConfigFormat format, String source) throws UrlKitException {
        if (content == null || content.isBlank()) {
            throw new ConfigError.InvalidConfig("configuration from " + source + " is empty").exception();
        }
        var mapper = switch (format) {
            case JSON -> JSON_MAPPER;
            case YAML -> YAML_MAPPER;
        };
        RouteConfig config;
        try{
            config = mapper.readValue(content, RouteConfig.class);
        } catch (JsonProcessingException e) {
            log.warn("Cannot parse {} route configuration from {}: {}", format, source, e.getOriginalMessage());
            throw new ConfigError.ParseFailed(source, e.getOriginalMessage()).exception();
        }
        if (config == null) {
            throw new ConfigError.InvalidConfig("configuration from " + source + " is empty").exception();
        }
        return ConfigValidator.validate(config);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
