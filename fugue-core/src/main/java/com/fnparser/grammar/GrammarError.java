package com.fnparser.grammar;

import com.fnparser.ParseError;
import com.fnparser.Token;
import com.fnparser.ast.Spanned;

import java.util.List;

/**
 * Errors in the form the grammar produces them. Expected terminals are quoted, and an
 * end-of-input location of {@code 0} means the position was never known.
 * {@link com.fnparser.ErrorTranslator} turns these into {@link ParseError}s.
 */
public sealed interface GrammarError {

    record InvalidToken(int location) implements GrammarError {
    }

    record UnrecognizedToken(Token token, List<String> expected) implements GrammarError {
        public UnrecognizedToken {
            expected = List.copyOf(expected);
        }
    }

    record UnrecognizedEof(int location, List<String> expected) implements GrammarError {
        public UnrecognizedEof {
            expected = List.copyOf(expected);
        }
    }

    record ExtraToken(Token token) implements GrammarError {
    }

    /**
     * An error raised by a semantic action or passed through from the token stream.
     */
    record User(Spanned<ParseError> error) implements GrammarError {
    }
}
