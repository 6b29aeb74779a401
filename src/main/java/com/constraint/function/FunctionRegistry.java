package com.constraint.function;

import com.constraint.config.expression.DslStrings;
import com.constraint.config.expression.DslSymbols;
import com.constraint.exception.DuplicateFunctionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Names callable from the DSL, each bound to its implementation.
 * <p>
 * Membership decides whether an identifier in an expression is a function call or a
 * statement reference. The registry only grows. Registration belongs to the configuration
 * phase; lookups may run concurrently with each other but not with {@link #register}.
 */
public class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    // Copy-on-write so lookups never see a half-applied registration
    private volatile Map<String, DslFunction> functions = Map.of();

    /**
     * Register a function.
     *
     * @param name     Function name, word characters only, not starting with a digit
     * @param function Implementation
     * @throws DuplicateFunctionException if the name is already registered
     */
    public synchronized void register(String name, DslFunction function) {
        Objects.requireNonNull(function, "function");
        if (name == null || name.isEmpty() || DslStrings.wordLength(name, 0) != name.length()
                || DslSymbols.isDigit(name.charAt(0))) {
            throw new IllegalArgumentException("Invalid function name: '" + name
                    + "'. Names must consist of letters, digits and underscores and must not start with a digit");
        }
        if (functions.containsKey(name)) {
            throw new DuplicateFunctionException(name);
        }
        Map<String, DslFunction> updated = new LinkedHashMap<>(functions);
        updated.put(name, function);
        functions = Collections.unmodifiableMap(updated);
        log.debug("Registered function '{}'", name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Optional<DslFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Check whether the text starts with any registered name.
     * Used to recognise a function call or statement at the current scan position.
     */
    public boolean matchesPrefix(String text) {
        for (String name : functions.keySet()) {
            if (text.startsWith(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A token is a statement when it starts with a registered name and carries no brackets.
     */
    public boolean isStatementToken(String token) {
        return matchesPrefix(token)
                && token.indexOf(DslSymbols.BRACKET_OPEN) == -1
                && token.indexOf(DslSymbols.BRACKET_CLOSE) == -1;
    }

    public Set<String> names() {
        return functions.keySet();
    }

    /**
     * Snapshot of all registrations, in registration order.
     */
    public Map<String, DslFunction> asMap() {
        return functions;
    }

    public int size() {
        return functions.size();
    }
}
