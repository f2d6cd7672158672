package com.fnparser.ast;

/**
 * A type still to be inferred, written {@code _} or left out entirely.
 */
public record TypeHole(
    int start,
    int end
) implements AstType {
    @Override
    public String type() {
        return "TypeHole";
    }
}
