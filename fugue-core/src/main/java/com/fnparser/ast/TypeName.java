package com.fnparser.ast;

public record TypeName(
    int start,
    int end,
    Symbol name
) implements AstType {
    @Override
    public String type() {
        return "TypeName";
    }
}
