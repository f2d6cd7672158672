package com.fnparser.ast;

public record TypedIdent(Symbol name, AstType typ) {

    public static TypedIdent of(Symbol name, TypeCache typeCache) {
        return new TypedIdent(name, typeCache.hole());
    }
}
