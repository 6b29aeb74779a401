package com.constraint.function;

import com.constraint.exception.DuplicateFunctionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FunctionRegistry.
 */
class FunctionRegistryTest {

    private FunctionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new FunctionRegistry();
    }

    @Test
    @DisplayName("Registered function can be found by name")
    void register() {
        DslFunction add = args -> 1;
        registry.register("add", add);

        assertTrue(registry.contains("add"));
        assertSame(add, registry.find("add").orElseThrow());
        assertTrue(registry.find("mul").isEmpty());
    }

    @Test
    @DisplayName("Duplicate registration fails and keeps the original binding")
    void duplicate() {
        DslFunction original = args -> 1;
        registry.register("add", original);

        DuplicateFunctionException e = assertThrows(DuplicateFunctionException.class,
                () -> registry.register("add", args -> 2));

        assertEquals("add", e.getFunctionName());
        assertEquals(1, registry.size());
        assertSame(original, registry.find("add").orElseThrow());
    }

    @Test
    @DisplayName("Names must consist of word characters")
    void invalidNames() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("a-b", args -> null));
        assertThrows(IllegalArgumentException.class, () -> registry.register("", args -> null));
        assertThrows(IllegalArgumentException.class, () -> registry.register("1x", args -> null));
        assertThrows(IllegalArgumentException.class, () -> registry.register(null, args -> null));
        assertThrows(NullPointerException.class, () -> registry.register("ok", null));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Digits are allowed after the first character")
    void digitsInName() {
        registry.register("x1", args -> null);

        assertTrue(registry.contains("x1"));
    }

    @Test
    @DisplayName("Prefix matching recognises calls and statements")
    void prefixMatching() {
        registry.register("isVip", args -> true);

        assertTrue(registry.matchesPrefix("isVip"));
        assertTrue(registry.matchesPrefix("isVip($a)==1"));
        assertFalse(registry.matchesPrefix("isV"));

        assertTrue(registry.isStatementToken("isVip"));
        assertTrue(registry.isStatementToken("isVip,"));
        assertFalse(registry.isStatementToken("isVip($a)"));
        assertFalse(registry.isStatementToken("$isVip"));
    }

    @Test
    @DisplayName("Snapshot keeps registration order and cannot be modified")
    void snapshot() {
        registry.register("b", args -> null);
        registry.register("a", args -> null);

        assertEquals(List.of("b", "a"), List.copyOf(registry.names()));
        assertThrows(UnsupportedOperationException.class, () -> registry.asMap().put("c", args -> null));
    }
}
