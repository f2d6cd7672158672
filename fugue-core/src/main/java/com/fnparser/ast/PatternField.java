package com.fnparser.ast;

/**
 * A record pattern field. {@code value} is null for a punned field, in which case the field
 * name is also the bound variable.
 */
public record PatternField(
    int start,
    int end,
    Spanned<Symbol> name,
    Pattern value
) implements Node {

    public boolean isPunned() {
        return value == null;
    }

    @Override
    public String type() {
        return "PatternField";
    }
}
