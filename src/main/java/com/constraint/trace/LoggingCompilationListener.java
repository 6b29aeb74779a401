package com.constraint.trace;

import com.constraint.config.expression.Token;
import com.constraint.core.Constraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes every compilation trace point to the log at debug level.
 */
public class LoggingCompilationListener implements CompilationListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingCompilationListener.class);

    @Override
    public void onSplit(String assertion, String activation, String condition) {
        log.debug("Split '{}' into activation '{}' and condition '{}'", assertion, activation, condition);
    }

    @Override
    public void onTokenized(String expression, List<Token> tokens) {
        log.debug("Tokenized '{}': {}", expression, tokens);
    }

    @Override
    public void onCompiled(String assertion, Constraint constraint) {
        log.debug("Compiled '{}' to {}", assertion, constraint);
    }
}
