package com.fnparser;

import com.fnparser.ast.Span;

/**
 * A lexed token. {@code literal} holds the decoded value of literal tokens and the text of doc
 * comments; {@code error} is only set on {@link TokenType#ERROR} items.
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int start,
    int end,
    int line,
    int column,
    ParseError error
) {

    public Token(TokenType type, String lexeme, Object literal, int start, int end, int line, int column) {
        this(type, lexeme, literal, start, end, line, column, null);
    }

    public static Token error(ParseError error, int start, int end, int line, int column) {
        return new Token(TokenType.ERROR, "", null, start, end, line, column, error);
    }

    /**
     * A zero-width token inserted by the layout engine in front of {@code next}.
     */
    public static Token virtual(TokenType type, Token next) {
        return new Token(type, "", null, next.start(), next.start(), next.line(), next.column());
    }

    /**
     * Line of the last character. Differs from {@link #line()} for strings and block comments
     * spanning several lines.
     */
    public int endLine() {
        int newlines = 0;
        for (int i = 0; i < lexeme.length(); i++) {
            if (lexeme.charAt(i) == '\n') {
                newlines++;
            }
        }
        return line + newlines;
    }

    public Span span() {
        return new Span(start, end);
    }

    public boolean isVirtual() {
        return type.isLayout();
    }

    @Override
    public String toString() {
        return switch (type) {
            case IDENTIFIER, OPERATOR, INT, BYTE, FLOAT, STRING, CHAR, LITERAL_SUFFIX -> lexeme;
            default -> type.display();
        };
    }
}
