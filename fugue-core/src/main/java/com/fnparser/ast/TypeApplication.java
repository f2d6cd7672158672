package com.fnparser.ast;

import java.util.List;

public record TypeApplication(
    int start,
    int end,
    AstType constructor,
    List<AstType> arguments
) implements AstType {
    @Override
    public String type() {
        return "TypeApplication";
    }
}
