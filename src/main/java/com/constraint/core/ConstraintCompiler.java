package com.constraint.core;

import com.constraint.activation.Activation;
import com.constraint.activation.impl.AlwaysActivation;
import com.constraint.activation.impl.ConditionalActivation;
import com.constraint.activation.impl.StatementActivation;
import com.constraint.config.ConstraintDefinition;
import com.constraint.config.ExpressionCompiler;
import com.constraint.config.expression.DslStrings;
import com.constraint.exception.DslSyntaxException;
import com.constraint.exception.UnknownFunctionException;
import com.constraint.expression.Expression;
import com.constraint.function.DslFunction;
import com.constraint.function.FunctionRegistry;
import com.constraint.trace.CompilationListener;
import com.constraint.variable.DefaultValueResolver;
import com.constraint.variable.ValueResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.constraint.config.expression.DslSymbols.*;

/**
 * Compiles assertions of the form {@code <activation>:<condition>} into constraints.
 * <p>
 * Activation forms:
 * <ul>
 *   <li>{@code ALWAYS} - the condition must always hold</li>
 *   <li>{@code WHEN(expression)} - the condition must hold while the expression holds</li>
 *   <li>a registered statement name - the condition must hold while the statement returns true</li>
 * </ul>
 * Any other activation is rejected at compile time.
 */
public class ConstraintCompiler {

    private static final Logger log = LoggerFactory.getLogger(ConstraintCompiler.class);

    private final FunctionRegistry functions;
    private final CompilationListener listener;
    private final ExpressionCompiler expressionCompiler;

    public ConstraintCompiler() {
        this(new FunctionRegistry());
    }

    public ConstraintCompiler(FunctionRegistry functions) {
        this(functions, new DefaultValueResolver(), CompilationListener.NOOP);
    }

    public ConstraintCompiler(FunctionRegistry functions, ValueResolver resolver, CompilationListener listener) {
        this.functions = functions;
        this.listener = listener;
        this.expressionCompiler = new ExpressionCompiler(functions, resolver, listener);
    }

    /**
     * Register a function callable from assertions.
     *
     * @throws com.constraint.exception.DuplicateFunctionException if the name is taken
     */
    public void registerFunction(String name, DslFunction function) {
        functions.register(name, function);
    }

    public FunctionRegistry getFunctionRegistry() {
        return functions;
    }

    /**
     * Compile an assertion.
     *
     * @param assertion Assertion text
     * @return Compiled constraint
     * @throws DslSyntaxException       if the assertion is malformed
     * @throws UnknownFunctionException if it references an unregistered function
     */
    public Constraint compile(String assertion) {
        if (assertion == null) {
            throw new DslSyntaxException("Assertion cannot be null");
        }

        List<String> parts = splitAssertion(assertion);
        String activationText = parts.get(0).trim();
        String conditionText = parts.get(1).trim();
        listener.onSplit(assertion, activationText, conditionText);

        Activation activation = compileActivation(activationText, assertion);
        if (conditionText.isEmpty()) {
            throw new DslSyntaxException("Missing condition in '" + assertion + "'", assertion.length());
        }
        Expression condition = expressionCompiler.compile(conditionText);

        Constraint constraint = new DefaultConstraint(assertion, activation, condition, functions);
        listener.onCompiled(assertion, constraint);
        return constraint;
    }

    /**
     * Compile a named definition.
     */
    public CompiledConstraint compile(ConstraintDefinition definition) {
        log.debug("Compiling constraint '{}'", definition.name());
        return new CompiledConstraint(definition, compile(definition.assertion()));
    }

    /**
     * Split an assertion at the first separator that is not inside a string literal.
     *
     * @param assertion Assertion text
     * @return Activation text and condition text, untrimmed
     * @throws DslSyntaxException if there is no such separator
     */
    public static List<String> splitAssertion(String assertion) {
        for (int i = 0; i < assertion.length(); i++) {
            if (assertion.charAt(i) == COND_SEPARATOR && !DslStrings.isCharWithinString(assertion, i)) {
                return List.of(assertion.substring(0, i), assertion.substring(i + 1));
            }
        }
        throw new DslSyntaxException("Missing '" + COND_SEPARATOR + "' between activation and condition in '"
                + assertion + "'");
    }

    private Activation compileActivation(String activation, String assertion) {
        if (activation.startsWith(ALWAYS)) {
            return AlwaysActivation.INSTANCE;
        }

        if (activation.startsWith(WHEN)) {
            String body = DslStrings.substringWithinParentheses(activation);
            int close = DslStrings.closingBracketIndex(activation, activation.indexOf(BRACKET_OPEN));
            if (close != activation.length() - 1) {
                throw new DslSyntaxException("Unexpected text after WHEN(...) in '" + assertion + "'", close + 1);
            }
            return new ConditionalActivation(expressionCompiler.compile(body));
        }

        if (functions.isStatementToken(activation)) {
            if (!functions.contains(activation)) {
                if (DslStrings.wordLength(activation, 0) != activation.length()) {
                    throw new DslSyntaxException("Unrecognized activation '" + activation + "' in '"
                            + assertion + "'", 0);
                }
                throw new UnknownFunctionException(activation);
            }
            return new StatementActivation(activation);
        }

        throw new DslSyntaxException("Unrecognized activation '" + activation + "' in '" + assertion
                + "'. Expected " + ALWAYS + ", " + WHEN + "(...) or a registered statement", 0);
    }
}
