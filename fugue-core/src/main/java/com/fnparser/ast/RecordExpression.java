package com.fnparser.ast;

import java.util.List;

public record RecordExpression(
    int start,
    int end,
    List<ExprField> fields
) implements Expression {
    @Override
    public String type() {
        return "RecordExpression";
    }
}
