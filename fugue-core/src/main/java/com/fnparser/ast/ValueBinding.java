package com.fnparser.ast;

import java.util.List;

/**
 * {@code let name args : typ = expression}. Function bindings have an identifier pattern and
 * at least one parameter; destructuring bindings have none.
 */
public record ValueBinding(
    int start,
    int end,
    Metadata metadata,
    Pattern name,
    List<Identifier> parameters,
    AstType typ,  // null when not annotated
    Expression expression
) implements Node {

    public ValueBinding withExpression(Expression newExpression) {
        return new ValueBinding(start, newExpression.end(), metadata, name, parameters, typ, newExpression);
    }

    @Override
    public String type() {
        return "ValueBinding";
    }
}
