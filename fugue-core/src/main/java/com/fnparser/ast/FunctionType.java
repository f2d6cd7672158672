package com.fnparser.ast;

public record FunctionType(
    int start,
    int end,
    AstType parameter,
    AstType result
) implements AstType {
    @Override
    public String type() {
        return "FunctionType";
    }
}
