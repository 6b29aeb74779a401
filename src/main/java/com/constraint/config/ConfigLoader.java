package com.constraint.config;

import com.constraint.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads constraint sets from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load a constraint set from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded constraint set
     * @throws ConfigurationException if the file cannot be read or is malformed
     */
    public static ConstraintSetConfig load(String path) {
        log.info("Loading constraint configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse a constraint set from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static ConstraintSetConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Malformed constraint configuration: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The set may sit at the root or under 'constraints'
        Map<String, Object> setConfig = root.containsKey("constraints")
                ? asMap(root.get("constraints"), "constraints")
                : root;

        String name = getString(setConfig, "name", "default");
        List<ConstraintDefinition> definitions = parseDefinitions(setConfig.get("definitions"));

        if (definitions.isEmpty()) {
            log.warn("Constraint set '{}' has no definitions", name);
        }

        log.info("Loaded constraint set '{}' with {} definitions", name, definitions.size());
        return new ConstraintSetConfig(name, definitions);
    }

    private static List<ConstraintDefinition> parseDefinitions(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'definitions' must be a list");
        }

        List<ConstraintDefinition> definitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> map = asMap(list.get(i), "definitions[" + i + "]");

            String name = getString(map, "name", null);
            String assertion = getString(map, "assertion", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Constraint definition " + i + " has no name");
            }
            if (assertion == null || assertion.isBlank()) {
                throw new ConfigurationException("Constraint '" + name + "' has no assertion");
            }
            String message = getString(map, "message", null);

            definitions.add(new ConstraintDefinition(name, assertion, message));
            log.debug("Parsed constraint definition: name={}, assertion={}", name, assertion);
        }
        return definitions;
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
