package com.fnparser.infix;

public enum Fixity {
    LEFT,
    RIGHT;

    @Override
    public String toString() {
        return this == LEFT ? "infixl" : "infixr";
    }
}
