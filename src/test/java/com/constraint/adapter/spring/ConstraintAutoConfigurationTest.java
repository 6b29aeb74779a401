package com.constraint.adapter.spring;

import com.constraint.config.ConstraintSetConfig;
import com.constraint.core.ConstraintCompiler;
import com.constraint.function.FunctionRegistry;
import com.constraint.message.MessageRenderer;
import com.constraint.validation.ConstraintValidator;
import com.constraint.validation.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConstraintAutoConfiguration wiring in a plain application context.
 */
class ConstraintAutoConfigurationTest {

    @Configuration
    static class TestFunctions {

        @Bean
        FunctionContributor vipFunctions() {
            return registry -> registry.register("isVip", args -> {
                Map<?, ?> customer = (Map<?, ?>) ((Map<?, ?>) args[0]).get("customer");
                return customer != null && "GOLD".equals(customer.get("tier"));
            });
        }

        @Bean
        FunctionContributor formatFunctions() {
            return registry -> registry.register("upper", args -> String.valueOf(args[0]).toUpperCase());
        }
    }

    private AnnotationConfigApplicationContext context(Map<String, Object> properties) {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
        context.register(TestFunctions.class, ConstraintAutoConfiguration.class);
        context.refresh();
        return context;
    }

    @Test
    @DisplayName("Beans are created from properties and contributors")
    void wiring() {
        try (AnnotationConfigApplicationContext context = context(Map.of(
                "constraints.config-path", "classpath:test-constraints.yaml",
                "constraints.missing-value-text", "?"))) {

            FunctionRegistry registry = context.getBean(FunctionRegistry.class);
            assertTrue(registry.contains("isVip"));
            assertTrue(registry.contains("upper"));

            assertEquals("test-rules", context.getBean(ConstraintSetConfig.class).name());
            assertSame(registry, context.getBean(ConstraintCompiler.class).getFunctionRegistry());
            assertEquals("?", context.getBean(MessageRenderer.class).render("$x", Map.of(), Map.of()));

            ConstraintValidator validator = context.getBean(ConstraintValidator.class);
            ValidationResult result = validator.validate(
                    Map.of("order", Map.of("total", -1, "ref", "A")), Map.of("strict", true));
            assertEquals(1, result.getViolations().size());
            assertEquals("Order total must be positive but was -1", result.getViolations().get(0).message());
        }
    }

    @Test
    @DisplayName("Properties default when not set")
    void defaults() {
        ConstraintProperties properties = new ConstraintProperties();

        assertTrue(properties.isEnabled());
        assertEquals("classpath:constraints.yaml", properties.getConfigPath());
        assertEquals("UNDEFINED_VALUE", properties.getMissingValueText());
        assertFalse(properties.isTrace());
    }

    @Test
    @DisplayName("Disabled configuration creates no beans")
    void disabled() {
        try (AnnotationConfigApplicationContext context = context(Map.of("constraints.enabled", "false"))) {
            assertNull(context.getBeanProvider(ConstraintValidator.class).getIfAvailable());
            assertNull(context.getBeanProvider(FunctionRegistry.class).getIfAvailable());
        }
    }

    @Test
    @DisplayName("Trace flag installs the logging listener")
    void trace() {
        try (AnnotationConfigApplicationContext context = context(Map.of(
                "constraints.config-path", "classpath:test-constraints.yaml",
                "constraints.trace", "true"))) {

            ConstraintCompiler compiler = context.getBean(ConstraintCompiler.class);
            assertTrue(compiler.compile("ALWAYS: upper('a') == 'A'").evaluate(Map.of(), Map.of()));
        }
    }
}
