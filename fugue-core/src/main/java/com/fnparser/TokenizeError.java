package com.fnparser;

/**
 * Lexical errors. {@code detail} carries the offending character or text where there is one.
 */
public record TokenizeError(Kind kind, String detail) {

    public enum Kind {
        UNEXPECTED_CHAR,
        UNEXPECTED_ESCAPE_CODE,
        UNTERMINATED_STRING_LITERAL,
        UNTERMINATED_CHAR_LITERAL,
        EMPTY_CHAR_LITERAL,
        UNTERMINATED_BLOCK_COMMENT,
        NON_PARSEABLE_INT,
        BYTE_LITERAL_OVERFLOW
    }

    public TokenizeError(Kind kind) {
        this(kind, null);
    }

    public String message() {
        return switch (kind) {
            case UNEXPECTED_CHAR -> "unexpected character `" + detail + "`";
            case UNEXPECTED_ESCAPE_CODE -> "unexpected escape code `\\" + detail + "`";
            case UNTERMINATED_STRING_LITERAL -> "unterminated string literal";
            case UNTERMINATED_CHAR_LITERAL -> "unterminated character literal";
            case EMPTY_CHAR_LITERAL -> "empty character literal";
            case UNTERMINATED_BLOCK_COMMENT -> "unterminated block comment";
            case NON_PARSEABLE_INT -> "cannot parse integer `" + detail + "`, probable overflow";
            case BYTE_LITERAL_OVERFLOW -> "byte literal `" + detail + "` is out of range (0-255)";
        };
    }
}
