package com.fnparser.layout;

import com.fnparser.TokenType;
import com.fnparser.ast.Span;

/**
 * One frame of the layout stack: a block opened implicitly by indentation or explicitly by a
 * bracket.
 */
public record LayoutContext(Kind kind, int column, Span openSpan) {

    public enum Kind {
        BLOCK(null, null),
        PAREN("(", TokenType.RPAREN),
        BRACKET("[", TokenType.RBRACKET),
        BRACE("{", TokenType.RBRACE),
        ATTRIBUTE("#[", TokenType.RBRACKET);

        private final String open;
        private final TokenType closer;

        Kind(String open, TokenType closer) {
            this.open = open;
            this.closer = closer;
        }

        public String open() {
            return open;
        }

        public TokenType closer() {
            return closer;
        }

        static Kind opened(TokenType type) {
            return switch (type) {
                case LPAREN -> PAREN;
                case LBRACKET -> BRACKET;
                case LBRACE -> BRACE;
                case ATTRIBUTE_OPEN -> ATTRIBUTE;
                default -> throw new IllegalArgumentException("Not an opening delimiter: " + type);
            };
        }
    }

    public boolean isImplicit() {
        return kind == Kind.BLOCK;
    }

    public boolean isExplicit() {
        return kind != Kind.BLOCK;
    }
}
