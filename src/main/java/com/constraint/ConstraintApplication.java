package com.constraint;

import com.constraint.adapter.spring.FunctionContributor;
import com.constraint.core.ContextFactory;
import com.constraint.expression.Values;
import com.constraint.spring.EnableConstraints;
import com.constraint.validation.ConstraintValidator;
import com.constraint.validation.ValidationResult;
import com.constraint.validation.Violation;
import com.constraint.variable.DefaultValueResolver;
import com.constraint.variable.ValueResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating constraint validation.
 */
@SpringBootApplication
@EnableConstraints
public class ConstraintApplication {

    private static final Logger log = LoggerFactory.getLogger(ConstraintApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ConstraintApplication.class, args);
    }

    @Bean
    public FunctionContributor demoFunctions() {
        ValueResolver resolver = new DefaultValueResolver();
        return registry -> {
            // Statement: receives (model, state)
            registry.register("isVip", args -> "GOLD".equals(resolver.resolve(args[0], "customer.tier")));
            registry.register("maxOf", args -> Math.max(Values.toNumber(args[0]), Values.toNumber(args[1])));
            registry.register("upper", args -> args[0] == null ? null : args[0].toString().toUpperCase());
        };
    }

    @Bean
    public CommandLineRunner demo(ConstraintValidator validator) {
        return args -> {
            log.info("=== Constraint Demo Started ===");

            List<String> orders = List.of(
                    """
                    {"customer": {"tier": "GOLD"}, "order": {"total": 250, "discount": 25, "items": 4}}
                    """,
                    """
                    {"customer": {"tier": "silver"}, "order": {"total": 0, "discount": 15, "items": 1}}
                    """);

            Map<String, Object> state = Map.of("attempts", 3);
            for (String json : orders) {
                ValidationResult result = validator.validate(ContextFactory.fromJson(json), state);
                log.info("{}", result.getExplanation());
                for (Violation violation : result.getViolations()) {
                    log.info("  [{}] {}", violation.name(), violation.message());
                }
            }

            log.info("=== Constraint Demo Completed ===");
        };
    }
}
