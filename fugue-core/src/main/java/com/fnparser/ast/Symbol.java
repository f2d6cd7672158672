package com.fnparser.ast;

/**
 * An interned name. Two symbols handed out by the same {@link IdentEnv} for the same text
 * are equal.
 */
public record Symbol(String name) {

    private static final String OPERATOR_CHARS = "!#$%&*+-./:<=>?@\\^|~";

    public static boolean isOperatorChar(char c) {
        return OPERATOR_CHARS.indexOf(c) >= 0;
    }

    /**
     * True when the name starts with an operator character, i.e. it can only be used infix.
     */
    public boolean isOperator() {
        return !name.isEmpty() && isOperatorChar(name.charAt(0));
    }

    @Override
    public String toString() {
        return name;
    }
}
