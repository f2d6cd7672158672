package com.fnparser.ast;

public record Identifier(
    int start,
    int end,
    TypedIdent ident
) implements Expression {

    public Symbol name() {
        return ident.name();
    }

    public Identifier withSpan(int newStart, int newEnd) {
        return new Identifier(newStart, newEnd, ident);
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
