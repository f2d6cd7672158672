package com.fnparser;

/**
 * Thrown by the non-partial entry points when a parse produced any error.
 */
public class ParseException extends RuntimeException {

    private final ParseErrors errors;

    public ParseException(ParseErrors errors) {
        super(errors.toString());
        this.errors = errors;
    }

    public ParseErrors errors() {
        return errors;
    }
}
