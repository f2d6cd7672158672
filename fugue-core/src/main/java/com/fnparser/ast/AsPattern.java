package com.fnparser.ast;

public record AsPattern(
    int start,
    int end,
    IdentifierPattern binding,
    Pattern pattern
) implements Pattern {
    @Override
    public String type() {
        return "AsPattern";
    }
}
