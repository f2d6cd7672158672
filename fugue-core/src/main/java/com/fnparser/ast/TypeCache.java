package com.fnparser.ast;

/**
 * Source of the placeholder types attached to identifiers before inference runs.
 */
public class TypeCache {

    private final TypeHole hole = new TypeHole(0, 0);

    public AstType hole() {
        return hole;
    }
}
