package com.fnparser.ast;

import java.util.List;

public record RecordPattern(
    int start,
    int end,
    List<PatternField> fields
) implements Pattern {
    @Override
    public String type() {
        return "RecordPattern";
    }
}
