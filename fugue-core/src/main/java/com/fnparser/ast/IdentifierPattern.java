package com.fnparser.ast;

public record IdentifierPattern(
    int start,
    int end,
    TypedIdent ident
) implements Pattern {

    public Symbol name() {
        return ident.name();
    }

    @Override
    public String type() {
        return "IdentifierPattern";
    }
}
