package com.fnparser.ast;

public record Alternative(
    int start,
    int end,
    Pattern pattern,
    Expression expression
) implements Node {
    @Override
    public String type() {
        return "Alternative";
    }
}
