package com.fnparser.ast;

import java.util.List;

public record Variant(
    int start,
    int end,
    Identifier name,
    List<AstType> arguments
) implements Node {
    @Override
    public String type() {
        return "Variant";
    }
}
