package com.constraint.message;

import com.constraint.config.expression.DslStrings;
import com.constraint.config.expression.TokenType;
import com.constraint.exception.DslSyntaxException;
import com.constraint.exception.UnknownFunctionException;
import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Values;
import com.constraint.function.DslFunction;
import com.constraint.function.FunctionRegistry;
import com.constraint.variable.DataScope;
import com.constraint.variable.MissingValue;
import com.constraint.variable.ValueResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.constraint.config.expression.DslSymbols.*;

/**
 * Renders message templates by replacing each embedded reference with its current value.
 * <p>
 * Model references are resolved first, then state references, then statements and function
 * calls in template order. Function arguments are resolved depth-first: statements, nested
 * calls, data references, {@code 'text'} and number literals.
 */
public class MessageRenderer {

    private static final Logger log = LoggerFactory.getLogger(MessageRenderer.class);

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d*\\.)?\\d+");

    private final FunctionRegistry functions;
    private final ValueResolver resolver;
    private final MessageTokenizer tokenizer;
    private final String missingValueText;

    public MessageRenderer(FunctionRegistry functions, ValueResolver resolver) {
        this(functions, resolver, UNDEFINED_VALUE);
    }

    public MessageRenderer(FunctionRegistry functions, ValueResolver resolver, String missingValueText) {
        this.functions = functions;
        this.resolver = resolver;
        this.tokenizer = new MessageTokenizer(functions);
        this.missingValueText = missingValueText;
    }

    /**
     * Render a template using the registered functions.
     */
    public String render(String template, Object model, Object state) {
        return render(template, model, state, functions.asMap());
    }

    /**
     * Render a template.
     *
     * @param template  Message template
     * @param model     Model data
     * @param state     State data
     * @param callables Callables by name; names are recognised through the registry
     * @return Template with every reference replaced by its textual value
     * @throws DslSyntaxException       if a call or argument is malformed
     * @throws UnknownFunctionException if a referenced function has no callable
     */
    public String render(String template, Object model, Object state, Map<String, DslFunction> callables) {
        if (template == null || template.isEmpty()) {
            return template;
        }

        List<MessageToken> tokens = tokenizer.tokenize(template);
        if (tokens.isEmpty()) {
            return template;
        }
        log.debug("Message tokens for '{}': {}", template, tokens);

        EvaluationContext context = new EvaluationContext(model, state, callables);
        Map<MessageToken, String> values = new HashMap<>();

        for (MessageToken token : tokens) {
            if (token.type() == TokenType.MODEL_REF) {
                values.put(token, toText(resolveData(DataScope.MODEL, token.text(), context)));
            }
        }
        for (MessageToken token : tokens) {
            if (token.type() == TokenType.STATE_REF) {
                values.put(token, toText(resolveData(DataScope.STATE, token.text(), context)));
            }
        }
        for (MessageToken token : tokens) {
            if (token.type() == TokenType.STATEMENT) {
                values.put(token, toText(context.invokeStatement(requireRegistered(token.text()))));
            } else if (token.type() == TokenType.FUNCTION_CALL) {
                values.put(token, toText(evaluateCall(token.text(), context)));
            }
        }

        StringBuilder sb = new StringBuilder(template.length());
        int copied = 0;
        for (MessageToken token : tokens) {
            sb.append(template, copied, token.start()).append(values.get(token));
            copied = token.end();
        }
        sb.append(template, copied, template.length());
        return sb.toString();
    }

    private Object evaluateCall(String call, EvaluationContext context) {
        String name = requireRegistered(call.substring(0, DslStrings.wordLength(call, 0)));
        List<String> arguments = DslStrings.splitArguments(DslStrings.substringWithinParentheses(call));
        Object[] args = new Object[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = resolveArgument(arguments.get(i), context);
        }
        return context.invoke(name, args);
    }

    private Object resolveArgument(String argument, EvaluationContext context) {
        if (functions.isStatementToken(argument)) {
            return context.invokeStatement(requireRegistered(argument));
        }
        if (functions.matchesPrefix(argument)) {
            return evaluateCall(argument, context);
        }
        char first = argument.charAt(0);
        if (first == MODEL_PREFIX || first == STATE_PREFIX) {
            Object value = resolveData(DataScope.fromReference(argument), argument, context);
            return MissingValue.isMissing(value) ? null : value;
        }
        if (isString(argument)) {
            return argument.substring(1, argument.length() - 1);
        }
        if (NUMBER.matcher(argument).matches()) {
            return Double.parseDouble(argument);
        }
        throw new DslSyntaxException("Cannot resolve function argument '" + argument + "'");
    }

    private Object resolveData(DataScope scope, String reference, EvaluationContext context) {
        return resolver.resolve(scope.select(context.getModel(), context.getState()), reference.substring(1));
    }

    private String requireRegistered(String name) {
        if (!functions.contains(name)) {
            throw new UnknownFunctionException(name);
        }
        return name;
    }

    private static boolean isString(String argument) {
        return argument.length() >= 2
                && argument.charAt(0) == STRING_SYMBOL
                && argument.charAt(argument.length() - 1) == STRING_SYMBOL
                && argument.indexOf(FORBIDDEN_STRING_CHAR) == -1;
    }

    private String toText(Object value) {
        return MissingValue.isMissing(value) ? missingValueText : Values.toText(value);
    }
}
