package com.fnparser.ast;

import java.util.List;

public record TuplePattern(
    int start,
    int end,
    List<Pattern> elements
) implements Pattern {
    @Override
    public String type() {
        return "TuplePattern";
    }
}
