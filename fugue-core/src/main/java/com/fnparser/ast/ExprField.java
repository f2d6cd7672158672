package com.fnparser.ast;

/**
 * A record expression field. {@code value} is null for a punned field ({@code { x }}).
 */
public record ExprField(
    int start,
    int end,
    Spanned<Symbol> name,
    Expression value
) implements Node {
    @Override
    public String type() {
        return "ExprField";
    }
}
