package com.fnparser.ast;

public record AnnotatedExpression(
    int start,
    int end,
    Expression expression,
    AstType annotation
) implements Expression {
    @Override
    public String type() {
        return "AnnotatedExpression";
    }
}
