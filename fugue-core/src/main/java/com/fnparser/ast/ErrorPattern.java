package com.fnparser.ast;

public record ErrorPattern(
    int start,
    int end
) implements Pattern {
    @Override
    public String type() {
        return "ErrorPattern";
    }
}
