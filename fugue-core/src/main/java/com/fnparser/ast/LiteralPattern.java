package com.fnparser.ast;

public record LiteralPattern(
    int start,
    int end,
    Literal literal
) implements Pattern {
    @Override
    public String type() {
        return "LiteralPattern";
    }
}
