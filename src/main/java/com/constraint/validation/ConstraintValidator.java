package com.constraint.validation;

import com.constraint.config.ConstraintDefinition;
import com.constraint.config.ConstraintSetConfig;
import com.constraint.core.CompiledConstraint;
import com.constraint.core.ConstraintCompiler;
import com.constraint.message.MessageRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates model/state pairs against a constraint set.
 * Every definition is compiled once up front; validation evaluates all of them in definition
 * order and renders the message of each one that does not hold.
 */
public class ConstraintValidator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintValidator.class);

    private final String name;
    private final MessageRenderer renderer;
    private final List<CompiledConstraint> constraints;

    /**
     * @throws com.constraint.exception.DslSyntaxException       if a definition does not compile
     * @throws com.constraint.exception.UnknownFunctionException if a definition references an unregistered function
     */
    public ConstraintValidator(ConstraintSetConfig config, ConstraintCompiler compiler, MessageRenderer renderer) {
        this.name = config.name();
        this.renderer = renderer;
        this.constraints = compileAll(config, compiler);

        log.info("ConstraintValidator '{}' initialized with {} constraints", name, constraints.size());
    }

    private List<CompiledConstraint> compileAll(ConstraintSetConfig config, ConstraintCompiler compiler) {
        List<CompiledConstraint> compiled = new ArrayList<>();
        for (ConstraintDefinition definition : config.definitions()) {
            compiled.add(compiler.compile(definition));
            log.debug("Compiled constraint '{}': {}", definition.name(), definition.assertion());
        }
        return List.copyOf(compiled);
    }

    /**
     * Validate one model/state pair.
     *
     * @param model Model data
     * @param state State data
     * @return Result listing every violated constraint
     */
    public ValidationResult validate(Object model, Object state) {
        List<Violation> violations = new ArrayList<>();

        for (CompiledConstraint compiled : constraints) {
            if (compiled.constraint().evaluate(model, state)) {
                continue;
            }
            ConstraintDefinition definition = compiled.definition();
            String message = definition.hasMessage()
                    ? renderer.render(definition.message(), model, state)
                    : definition.assertion();
            violations.add(new Violation(compiled.name(), definition.assertion(), message));
            log.debug("Constraint '{}' violated: {}", compiled.name(), message);
        }

        if (violations.isEmpty()) {
            return DefaultValidationResult.valid();
        }
        log.debug("Constraint set '{}': {} of {} constraints violated", name, violations.size(), constraints.size());
        return DefaultValidationResult.invalid(violations);
    }

    public String getName() {
        return name;
    }

    public List<CompiledConstraint> getConstraints() {
        return constraints;
    }
}
