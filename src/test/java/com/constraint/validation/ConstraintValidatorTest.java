package com.constraint.validation;

import com.constraint.config.ConfigLoader;
import com.constraint.config.ConstraintDefinition;
import com.constraint.config.ConstraintSetConfig;
import com.constraint.core.ConstraintCompiler;
import com.constraint.core.ContextFactory;
import com.constraint.exception.UnknownFunctionException;
import com.constraint.function.FunctionRegistry;
import com.constraint.message.MessageRenderer;
import com.constraint.variable.DefaultValueResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConstraintValidator against the test constraint set.
 */
class ConstraintValidatorTest {

    private FunctionRegistry functions;
    private ConstraintCompiler compiler;
    private MessageRenderer renderer;
    private ConstraintValidator validator;

    @BeforeEach
    void setUp() {
        functions = new FunctionRegistry();
        functions.register("isVip", args -> {
            Map<?, ?> customer = (Map<?, ?>) ((Map<?, ?>) args[0]).get("customer");
            return customer != null && "GOLD".equals(customer.get("tier"));
        });
        compiler = new ConstraintCompiler(functions);
        renderer = new MessageRenderer(functions, new DefaultValueResolver());
        validator = new ConstraintValidator(ConfigLoader.load("classpath:test-constraints.yaml"), compiler, renderer);
    }

    @Test
    @DisplayName("Every definition is compiled up front")
    void compiledUpFront() {
        assertEquals("test-rules", validator.getName());
        assertEquals(3, validator.getConstraints().size());
    }

    @Test
    @DisplayName("Satisfied model yields a valid result")
    void valid() {
        Map<String, Object> model = ContextFactory.fromJson("""
                {"customer": {"tier": "GOLD"}, "order": {"total": 100, "discount": 20, "ref": "A-1"}}
                """);

        ValidationResult result = validator.validate(model, Map.of("strict", true));

        assertTrue(result.isValid());
        assertTrue(result.getViolations().isEmpty());
    }

    @Test
    @DisplayName("Violations are reported in definition order with rendered messages")
    void violations() {
        Map<String, Object> model = ContextFactory.fromJson("""
                {"customer": {"tier": "GOLD"}, "order": {"total": 0, "discount": 45, "ref": ""}}
                """);

        ValidationResult result = validator.validate(model, Map.of("strict", true));

        assertFalse(result.isValid());
        List<Violation> violations = result.getViolations();
        assertEquals(List.of("positive-total", "vip-discount", "reference-present"),
                violations.stream().map(Violation::name).toList());
        assertEquals("Order total must be positive but was 0", violations.get(0).message());
        assertEquals("VIP discount 45 exceeds 30", violations.get(1).message());
        assertEquals("3 constraint(s) violated: positive-total, vip-discount, reference-present",
                result.getExplanation());
    }

    @Test
    @DisplayName("Violation without a message reports the raw assertion")
    void rawAssertion() {
        Map<String, Object> model = ContextFactory.fromJson("""
                {"order": {"total": 10, "ref": ""}}
                """);

        ValidationResult result = validator.validate(model, Map.of("strict", true));

        assertEquals(1, result.getViolations().size());
        Violation violation = result.getViolations().get(0);
        assertEquals("WHEN(#strict): $order.ref != ''", violation.message());
        assertEquals(violation.assertion(), violation.message());
    }

    @Test
    @DisplayName("Inactive constraints never fail")
    void inactive() {
        Map<String, Object> model = ContextFactory.fromJson("""
                {"customer": {"tier": "SILVER"}, "order": {"total": 10, "discount": 90, "ref": ""}}
                """);

        assertTrue(validator.validate(model, Map.of("strict", false)).isValid());
    }

    @Test
    @DisplayName("Unknown function in a definition fails construction")
    void unknownFunction() {
        ConstraintSetConfig config = new ConstraintSetConfig("bad", List.of(
                new ConstraintDefinition("uses-missing", "isVipGold: 1 == 1", null)));

        assertThrows(UnknownFunctionException.class, () -> new ConstraintValidator(config, compiler, renderer));
    }

    @Test
    @DisplayName("Empty set accepts everything")
    void emptySet() {
        ConstraintValidator empty = new ConstraintValidator(new ConstraintSetConfig("empty", null), compiler, renderer);

        assertTrue(empty.validate(Map.of(), Map.of()).isValid());
    }
}
