package com.fnparser;

import com.fnparser.ast.Span;
import com.fnparser.grammar.GrammarError;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts grammar errors into {@link ParseError}s, in order.
 */
public final class ErrorTranslator {

    private ErrorTranslator() {
    }

    public static ParseErrors transform(Span sourceSpan, Iterable<GrammarError> errors) {
        ParseErrors result = new ParseErrors();
        for (GrammarError error : errors) {
            translate(sourceSpan, error, result);
        }
        return result;
    }

    private static void translate(Span sourceSpan, GrammarError error, ParseErrors out) {
        if (error instanceof GrammarError.InvalidToken invalid) {
            out.push(Span.at(invalid.location()), new ParseError.InvalidToken());
        } else if (error instanceof GrammarError.UnrecognizedToken unrecognized) {
            out.push(unrecognized.token().span(), new ParseError.UnexpectedToken(
                unrecognized.token().toString(), removeExtraQuotes(unrecognized.expected())));
        } else if (error instanceof GrammarError.UnrecognizedEof eof) {
            // 0 is what the grammar reports when it never saw a token
            int location = eof.location() == 0 ? sourceSpan.end() : eof.location();
            out.push(Span.at(location), new ParseError.UnexpectedEof(removeExtraQuotes(eof.expected())));
        } else if (error instanceof GrammarError.ExtraToken extra) {
            out.push(extra.token().span(), new ParseError.ExtraToken(extra.token().toString()));
        } else if (error instanceof GrammarError.User user) {
            out.push(user.error());
        }
    }

    static List<String> removeExtraQuotes(List<String> expected) {
        List<String> result = new ArrayList<>(expected.size());
        for (String token : expected) {
            if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
                result.add(token.substring(1, token.length() - 1));
            } else {
                result.add(token);
            }
        }
        return result;
    }
}
