package com.constraint.expression.impl;

import com.constraint.expression.EvaluationContext;
import com.constraint.expression.Expression;
import com.constraint.expression.ExpressionType;
import com.constraint.variable.DataScope;
import com.constraint.variable.ValueResolver;

/**
 * Reads a dotted path from the model ({@code $a.b}) or state ({@code #a.b}).
 * An empty path denotes the whole object. Resolution happens at evaluation time.
 */
public class DataReferenceExpression implements Expression {

    private final DataScope scope;
    private final String path;
    private final ValueResolver resolver;

    public DataReferenceExpression(DataScope scope, String path, ValueResolver resolver) {
        this.scope = scope;
        this.path = path;
        this.resolver = resolver;
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return resolver.resolve(scope.select(context.getModel(), context.getState()), path);
    }

    @Override
    public ExpressionType getType() {
        return scope == DataScope.MODEL ? ExpressionType.MODEL_REF : ExpressionType.STATE_REF;
    }

    public DataScope getScope() {
        return scope;
    }

    public String getPath() {
        return path;
    }

    @Override
    public String toString() {
        return scope.getPrefix() + path;
    }
}
