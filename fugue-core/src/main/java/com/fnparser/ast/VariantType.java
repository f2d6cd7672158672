package com.fnparser.ast;

import java.util.List;

public record VariantType(
    int start,
    int end,
    List<Variant> variants
) implements AstType {
    @Override
    public String type() {
        return "VariantType";
    }
}
