package com.fnparser.infix;

/**
 * Checked failure of fixity attribute parsing; callers turn it into a spanned error.
 */
public class InfixException extends Exception {

    private final InfixError error;

    public InfixException(InfixError error) {
        super(error.message());
        this.error = error;
    }

    public InfixError error() {
        return error;
    }
}
