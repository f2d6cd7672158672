package com.fnparser;

import java.util.Optional;

/**
 * Outcome of a parse: a tree without errors, a partial tree with errors, or errors alone.
 */
public record ParseResult<T>(Optional<T> value, ParseErrors errors) {

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Optional.of(value), new ParseErrors());
    }

    public static <T> ParseResult<T> partial(T value, ParseErrors errors) {
        return new ParseResult<>(Optional.of(value), errors);
    }

    public static <T> ParseResult<T> failed(ParseErrors errors) {
        return new ParseResult<>(Optional.empty(), errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public T orElseThrow() {
        if (!isOk()) {
            throw new ParseException(errors);
        }
        return value.orElseThrow();
    }
}
