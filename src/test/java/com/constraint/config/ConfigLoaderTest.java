package com.constraint.config;

import com.constraint.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Loads a constraint set from the classpath")
    void loadFromClasspath() {
        ConstraintSetConfig config = ConfigLoader.load("classpath:test-constraints.yaml");

        assertEquals("test-rules", config.name());
        assertEquals(3, config.definitions().size());

        ConstraintDefinition first = config.definitions().get(0);
        assertEquals("positive-total", first.name());
        assertEquals("ALWAYS: $order.total > 0", first.assertion());
        assertEquals("Order total must be positive but was $order.total", first.message());
        assertTrue(first.hasMessage());

        ConstraintDefinition last = config.definitions().get(2);
        assertNull(last.message());
        assertFalse(last.hasMessage());
    }

    @Test
    @DisplayName("Set may sit at the document root")
    void rootLevel() {
        ConstraintSetConfig config = ConfigLoader.load("classpath:config/root-level.yaml");

        assertEquals("flat-rules", config.name());
        assertEquals(1, config.definitions().size());
    }

    @Test
    @DisplayName("Set without definitions is empty")
    void noDefinitions() {
        ConstraintSetConfig config = ConfigLoader.load("classpath:config/no-definitions.yaml");

        assertEquals("empty-rules", config.name());
        assertTrue(config.definitions().isEmpty());
    }

    @Test
    @DisplayName("Definition without an assertion is rejected")
    void missingAssertion() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:config/missing-assertion.yaml"));
        assertTrue(e.getMessage().contains("no-assertion"));
    }

    @Test
    @DisplayName("Definitions must be a list")
    void definitionsNotList() {
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:config/definitions-not-list.yaml"));
    }

    @Test
    @DisplayName("Missing files are configuration errors")
    void missingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/does/not/exist.yaml"));
    }

    @Test
    @DisplayName("Empty or malformed documents are configuration errors")
    void malformedDocument() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(stream("")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(stream("constraints: [unclosed")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(stream("- just\n- a list\n")));
    }

    private static ByteArrayInputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
