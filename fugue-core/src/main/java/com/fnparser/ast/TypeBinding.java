package com.fnparser.ast;

import java.util.List;

public record TypeBinding(
    int start,
    int end,
    Metadata metadata,
    Identifier name,
    List<Identifier> parameters,
    AstType definition
) implements Node {
    @Override
    public String type() {
        return "TypeBinding";
    }
}
