package com.fnparser;

import com.fnparser.infix.InfixError;
import com.fnparser.layout.LayoutError;

import java.util.List;

/**
 * Every error the parser reports. Grammar failures arrive here through
 * {@link ErrorTranslator}; tokenizer, layout and fixity errors are wrapped directly.
 */
public sealed interface ParseError {

    String message();

    default Diagnostic asDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, message());
    }

    record Tokenize(TokenizeError error) implements ParseError {
        @Override
        public String message() {
            return error.message();
        }
    }

    record Layout(LayoutError error) implements ParseError {
        @Override
        public String message() {
            return error.message();
        }
    }

    record InvalidToken() implements ParseError {
        @Override
        public String message() {
            return "Invalid token";
        }
    }

    record UnexpectedToken(String token, List<String> expected) implements ParseError {
        public UnexpectedToken {
            expected = List.copyOf(expected);
        }

        @Override
        public String message() {
            return "Unexpected token: " + token + expectedClause(expected);
        }
    }

    record UnexpectedEof(List<String> expected) implements ParseError {
        public UnexpectedEof {
            expected = List.copyOf(expected);
        }

        @Override
        public String message() {
            return "Unexpected end of file" + expectedClause(expected);
        }
    }

    record ExtraToken(String token) implements ParseError {
        @Override
        public String message() {
            return "Extra token: " + token;
        }
    }

    record Infix(InfixError error) implements ParseError {
        @Override
        public String message() {
            return error.message();
        }
    }

    record Message(String message) implements ParseError {
    }

    /**
     * Renders {@code "\nExpected a"} or {@code "\nExpected one of a, b or c"}; empty when
     * nothing was expected.
     */
    static String expectedClause(List<String> expected) {
        if (expected.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(expected.size() == 1 ? "\nExpected" : "\nExpected one of");
        for (int i = 0; i < expected.size(); i++) {
            if (i > 0) {
                sb.append(i + 1 < expected.size() ? "," : " or");
            }
            sb.append(' ').append(expected.get(i));
        }
        return sb.toString();
    }
}
