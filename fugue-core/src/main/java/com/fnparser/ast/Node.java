package com.fnparser.ast;

/**
 * Base interface for all spanned AST nodes
 */
public sealed interface Node permits
    Expression,
    Pattern,
    AstType,
    ValueBinding,
    TypeBinding,
    Alternative,
    ExprField,
    PatternField,
    Variant {

    String type();
    int start();
    int end();

    default Span span() {
        return new Span(start(), end());
    }
}
