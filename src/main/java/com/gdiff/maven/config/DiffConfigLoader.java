package com.gdiff.maven.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;

/**
 * Loads diff configuration from YAML files.
 */
public class DiffConfigLoader {

    public static final String DEFAULT_RESOURCE = "/gdiff/diff-config.yml";

    private static final Yaml yaml = new Yaml();

    /**
     * Loads configuration from a YAML file.
     */
    public static DiffConfig load(Path configPath) throws IOException {
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            return DiffConfig.fromMap(asMap(yaml.load(inputStream), configPath.toString()));
        }
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static DiffConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream inputStream = DiffConfigLoader.class
                .getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return DiffConfig.fromMap(asMap(yaml.load(inputStream), resourcePath));
        }
    }

    public static DiffConfig loadDefaults() throws IOException {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object data, String source) throws IOException {
        if (data == null) {
            return Map.of();
        }
        if (!(data instanceof Map)) {
            throw new IOException("Configuration must be a YAML mapping: " + source);
        }
        return (Map<String, Object>) data;
    }
}
