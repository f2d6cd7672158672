package com.fnparser;

/**
 * Pull interface between token producers and the grammar. After {@link TokenType#EOF} has been
 * returned every further call returns {@code EOF} again.
 */
public interface TokenSource {

    Token next();
}
