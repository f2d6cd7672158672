package com.fnparser.ast;

import java.util.List;

public record MatchExpression(
    int start,
    int end,
    Expression discriminant,
    List<Alternative> alternatives
) implements Expression {
    @Override
    public String type() {
        return "MatchExpression";
    }
}
