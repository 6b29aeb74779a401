package com.constraint.variable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultValueResolver.
 */
class DefaultValueResolverTest {

    private final ValueResolver resolver = new DefaultValueResolver();

    @Test
    @DisplayName("Nested map lookup")
    void nestedMap() {
        Map<String, Object> model = Map.of("a", Map.of("b", 5));

        assertEquals(5, resolver.resolve(model, "a.b"));
        assertEquals(Map.of("b", 5), resolver.resolve(model, "a"));
    }

    @Test
    @DisplayName("Empty path yields the root")
    void emptyPath() {
        Map<String, Object> model = Map.of("a", 1);

        assertSame(model, resolver.resolve(model, ""));
    }

    @Test
    @DisplayName("Missing keys yield the missing sentinel instead of failing")
    void missingPath() {
        Map<String, Object> model = Map.of("a", Map.of("b", 5));

        assertSame(MissingValue.INSTANCE, resolver.resolve(model, "a.c"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(model, "x.y.z"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(model, "a.b.c"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(null, "a"));
        assertFalse(resolver.exists(model, "a.c"));
        assertTrue(resolver.exists(model, "a.b"));
    }

    @Test
    @DisplayName("Present null is distinct from missing")
    void presentNull() {
        Map<String, Object> model = new HashMap<>();
        model.put("a", null);

        assertNull(resolver.resolve(model, "a"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(model, "a.b"));
    }

    @Test
    @DisplayName("List and array indices")
    void indices() {
        Map<String, Object> model = Map.of(
                "items", List.of("x", "y"),
                "codes", new int[]{7, 8});

        assertEquals("y", resolver.resolve(model, "items.1"));
        assertEquals(8, resolver.resolve(model, "codes.1"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(model, "items.2"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(model, "items.-1"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(model, "items.first"));
    }

    @Test
    @DisplayName("Jackson trees resolve to plain leaf values")
    void jsonNode() throws Exception {
        JsonNode node = new ObjectMapper().readTree(
                "{\"order\": {\"total\": 12.5, \"ref\": \"A1\", \"paid\": true, \"lines\": [{\"qty\": 3}]}}");

        assertEquals(12.5, resolver.resolve(node, "order.total"));
        assertEquals("A1", resolver.resolve(node, "order.ref"));
        assertEquals(true, resolver.resolve(node, "order.paid"));
        assertEquals(3, resolver.resolve(node, "order.lines.0.qty"));
        assertSame(MissingValue.INSTANCE, resolver.resolve(node, "order.discount"));
    }

    @Test
    @DisplayName("Unsupported value types cannot be walked")
    void unsupportedType() {
        assertSame(MissingValue.INSTANCE, resolver.resolve(Map.of("a", "text"), "a.length"));
    }
}
