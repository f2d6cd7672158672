package com.fnparser.grammar;

/**
 * Unwinds the grammar to the nearest statement that can recover, or out of the parse when the
 * error is at the end of input.
 */
public class GrammarException extends RuntimeException {

    private final GrammarError error;

    public GrammarException(GrammarError error) {
        super(error.toString(), null, false, false);
        this.error = error;
    }

    public GrammarError error() {
        return error;
    }

    public boolean isEndOfInput() {
        return error instanceof GrammarError.UnrecognizedEof;
    }
}
