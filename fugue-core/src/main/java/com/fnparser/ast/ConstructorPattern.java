package com.fnparser.ast;

import java.util.List;

public record ConstructorPattern(
    int start,
    int end,
    Identifier constructor,
    List<Pattern> arguments
) implements Pattern {
    @Override
    public String type() {
        return "ConstructorPattern";
    }
}
