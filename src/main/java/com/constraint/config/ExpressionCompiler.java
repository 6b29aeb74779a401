package com.constraint.config;

import com.constraint.config.expression.DslStrings;
import com.constraint.config.expression.ExpressionParser;
import com.constraint.config.expression.ExpressionTokenizer;
import com.constraint.config.expression.Token;
import com.constraint.exception.DslSyntaxException;
import com.constraint.expression.Expression;
import com.constraint.function.FunctionRegistry;
import com.constraint.trace.CompilationListener;
import com.constraint.variable.ValueResolver;

import java.util.List;

/**
 * Facade for compiling expression text into an Expression tree.
 * <p>
 * Supports:
 * <ul>
 *   <li>Data access: $model.path, #state.path, bare $ / # for the whole object</li>
 *   <li>Literals: 'text', 12, 3.5</li>
 *   <li>Comparisons: ==, !=, &gt;, &gt;=, &lt;, &lt;=</li>
 *   <li>Arithmetic: +, -, *, /, %</li>
 *   <li>Logical operators: &amp;&amp;, ||</li>
 *   <li>Registered function calls and bare statement references</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * Whitespace outside string literals is ignored.
 */
public final class ExpressionCompiler {

    private final FunctionRegistry functions;
    private final ValueResolver resolver;
    private final CompilationListener listener;

    public ExpressionCompiler(FunctionRegistry functions, ValueResolver resolver, CompilationListener listener) {
        this.functions = functions;
        this.resolver = resolver;
        this.listener = listener;
    }

    /**
     * Compile an expression.
     *
     * @param expression Expression string
     * @return Compiled expression tree
     */
    public Expression compile(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new DslSyntaxException("Expression cannot be empty");
        }

        // Tokenize
        String stripped = DslStrings.stripWhitespace(expression);
        List<Token> tokens = new ExpressionTokenizer(stripped, functions).tokenize();
        listener.onTokenized(stripped, tokens);

        // Parse
        ExpressionParser parser = new ExpressionParser(stripped, tokens, functions, resolver);
        return parser.parse();
    }
}
