package com.fnparser;

import com.fnparser.TokenizeError.Kind;
import com.fnparser.ast.Symbol;

/**
 * Lazily splits source text into tokens. Knows nothing about indentation; see
 * {@link com.fnparser.layout.Layout} for that.
 *
 * <p>Lexical errors do not stop the scan: the offending text becomes a {@link TokenType#ERROR}
 * token and scanning resumes after it.</p>
 */
public class Tokenizer implements TokenSource {

    private final String source;
    private final char[] buf;
    private final int length;
    private final int startIndex;

    private int pos = 0;
    private int line = 0;
    private int lineStart = 0;

    // A literal suffix is lexed together with its literal and handed out on the next call
    private Token pendingSuffix;

    public Tokenizer(ParserSource input) {
        this(input.src(), input.startIndex());
    }

    public Tokenizer(String source) {
        this(source, 0);
    }

    public Tokenizer(String source, int startIndex) {
        this.source = source;
        this.buf = source.toCharArray();
        this.length = buf.length;
        this.startIndex = startIndex;
    }

    @Override
    public Token next() {
        if (pendingSuffix != null) {
            Token suffix = pendingSuffix;
            pendingSuffix = null;
            return suffix;
        }

        Token comment = skipTrivia();
        if (comment != null) {
            return comment;
        }

        if (pos >= length) {
            return make(TokenType.EOF, pos, pos, null);
        }

        int start = pos;
        char c = buf[pos];

        if (isIdentifierStart(c)) {
            return identifier(start);
        }
        if (isDigit(c)) {
            return withSuffix(number(start));
        }
        if (c == '"') {
            return withSuffix(string(start));
        }
        if (c == '\'') {
            return character(start);
        }
        if (c == '#' && peekChar(1) == '[') {
            pos += 2;
            return make(TokenType.ATTRIBUTE_OPEN, start, pos, null);
        }
        if (Symbol.isOperatorChar(c)) {
            return operator(start);
        }

        pos++;
        TokenType punct = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case ',' -> TokenType.COMMA;
            case ';' -> TokenType.SEMICOLON;
            default -> null;
        };
        if (punct != null) {
            return make(punct, start, pos, null);
        }
        return error(new TokenizeError(Kind.UNEXPECTED_CHAR, String.valueOf(c)), start, pos);
    }

    // ========================================================================
    // Whitespace and comments
    // ========================================================================

    /**
     * Skips whitespace and ordinary comments. Returns a doc comment token, an error token for
     * an unterminated block comment, or null once the next real token is reached.
     */
    private Token skipTrivia() {
        while (pos < length) {
            char c = buf[pos];
            if (c == '\n') {
                pos++;
                line++;
                lineStart = pos;
            } else if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '/' && peekChar(1) == '/') {
                int start = pos;
                boolean doc = peekChar(2) == '/' && peekChar(3) != '/';
                while (pos < length && buf[pos] != '\n') {
                    pos++;
                }
                if (doc) {
                    String text = source.substring(start + 3, pos).trim();
                    return make(TokenType.DOC_COMMENT, start, pos, text);
                }
            } else if (c == '/' && peekChar(1) == '*') {
                int start = pos;
                int startLine = line;
                int startColumn = pos - lineStart;
                boolean doc = peekChar(2) == '*' && peekChar(3) != '/';
                pos += 2;
                while (pos < length && !(buf[pos] == '*' && peekChar(1) == '/')) {
                    if (buf[pos] == '\n') {
                        line++;
                        lineStart = pos + 1;
                    }
                    pos++;
                }
                if (pos >= length) {
                    return Token.error(new ParseError.Tokenize(new TokenizeError(Kind.UNTERMINATED_BLOCK_COMMENT)),
                        startIndex + start, startIndex + pos, startLine, startColumn);
                }
                pos += 2;
                if (doc) {
                    String text = source.substring(start + 3, pos - 2).trim();
                    return new Token(TokenType.DOC_COMMENT, source.substring(start, pos), text,
                        startIndex + start, startIndex + pos, startLine, startColumn);
                }
            } else {
                return null;
            }
        }
        return null;
    }

    // ========================================================================
    // Names
    // ========================================================================

    private Token identifier(int start) {
        while (pos < length && isIdentifierPart(buf[pos])) {
            pos++;
        }
        String text = source.substring(start, pos);
        TokenType keyword = TokenType.keyword(text);
        return make(keyword != null ? keyword : TokenType.IDENTIFIER, start, pos, null);
    }

    private Token operator(int start) {
        while (pos < length && Symbol.isOperatorChar(buf[pos])) {
            // A comment ends the operator
            if (buf[pos] == '/' && pos > start && (peekChar(1) == '/' || peekChar(1) == '*')) {
                break;
            }
            pos++;
        }
        String text = source.substring(start, pos);
        TokenType reserved = switch (text) {
            case "=" -> TokenType.EQUALS;
            case "->" -> TokenType.ARROW;
            case "|" -> TokenType.PIPE;
            case "\\" -> TokenType.BACKSLASH;
            case ":" -> TokenType.COLON;
            case "." -> TokenType.DOT;
            default -> TokenType.OPERATOR;
        };
        return make(reserved, start, pos, null);
    }

    // ========================================================================
    // Literals
    // ========================================================================

    private Token number(int start) {
        if (buf[pos] == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X') && isHexDigit(peekChar(2))) {
            pos += 2;
            while (pos < length && isHexDigit(buf[pos])) {
                pos++;
            }
            String text = source.substring(start, pos);
            try {
                return make(TokenType.INT, start, pos, Long.parseLong(text.substring(2), 16));
            } catch (NumberFormatException e) {
                return error(new TokenizeError(Kind.NON_PARSEABLE_INT, text), start, pos);
            }
        }

        while (pos < length && isDigit(buf[pos])) {
            pos++;
        }
        boolean isFloat = false;
        if (peekChar(0) == '.' && isDigit(peekChar(1))) {
            isFloat = true;
            pos++;
            while (pos < length && isDigit(buf[pos])) {
                pos++;
            }
        }
        if ((peekChar(0) == 'e' || peekChar(0) == 'E')
            && (isDigit(peekChar(1)) || ((peekChar(1) == '-' || peekChar(1) == '+') && isDigit(peekChar(2))))) {
            isFloat = true;
            pos += 2;
            while (pos < length && isDigit(buf[pos])) {
                pos++;
            }
        }

        String text = source.substring(start, pos);
        if (isFloat) {
            return make(TokenType.FLOAT, start, pos, Double.parseDouble(text));
        }

        // `12b` is a byte literal; any longer run of letters is a suffix
        boolean isByte = peekChar(0) == 'b' && !isIdentifierPart(peekChar(1));
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            if (isByte) {
                pos++;
            }
            return error(new TokenizeError(Kind.NON_PARSEABLE_INT, text), start, pos);
        }
        if (isByte) {
            pos++;
            if (value > 255) {
                return error(new TokenizeError(Kind.BYTE_LITERAL_OVERFLOW, text), start, pos);
            }
            return make(TokenType.BYTE, start, pos, (short) value);
        }
        return make(TokenType.INT, start, pos, value);
    }

    private Token string(int start) {
        pos++; // opening quote
        StringBuilder value = new StringBuilder();
        TokenizeError escapeError = null;
        int startLine = line;
        int startColumn = start - lineStart;
        while (pos < length && buf[pos] != '"') {
            char c = buf[pos];
            if (c == '\\') {
                int escapeStart = pos;
                int decoded = escape();
                if (decoded < 0 && escapeError == null) {
                    escapeError = new TokenizeError(Kind.UNEXPECTED_ESCAPE_CODE,
                        source.substring(escapeStart + 1, Math.min(escapeStart + 2, length)));
                } else if (decoded >= 0) {
                    value.appendCodePoint(decoded);
                }
            } else {
                if (c == '\n') {
                    line++;
                    lineStart = pos + 1;
                }
                value.append(c);
                pos++;
            }
        }
        if (pos >= length) {
            return Token.error(new ParseError.Tokenize(new TokenizeError(Kind.UNTERMINATED_STRING_LITERAL)),
                startIndex + start, startIndex + pos, startLine, startColumn);
        }
        pos++; // closing quote
        if (escapeError != null) {
            return Token.error(new ParseError.Tokenize(escapeError), startIndex + start, startIndex + pos,
                startLine, startColumn);
        }
        return new Token(TokenType.STRING, source.substring(start, pos), value.toString(),
            startIndex + start, startIndex + pos, startLine, startColumn);
    }

    private Token character(int start) {
        pos++; // opening quote
        if (peekChar(0) == '\'') {
            pos++;
            return error(new TokenizeError(Kind.EMPTY_CHAR_LITERAL), start, pos);
        }
        if (pos >= length || buf[pos] == '\n') {
            return error(new TokenizeError(Kind.UNTERMINATED_CHAR_LITERAL), start, pos);
        }
        int value;
        if (buf[pos] == '\\') {
            int escapeStart = pos;
            value = escape();
            if (value < 0) {
                skipPast('\'');
                return error(new TokenizeError(Kind.UNEXPECTED_ESCAPE_CODE,
                    source.substring(escapeStart + 1, Math.min(escapeStart + 2, length))), start, pos);
            }
        } else {
            value = source.codePointAt(pos);
            pos += Character.charCount(value);
        }
        if (peekChar(0) != '\'') {
            return error(new TokenizeError(Kind.UNTERMINATED_CHAR_LITERAL), start, pos);
        }
        pos++;
        return make(TokenType.CHAR, start, pos, value);
    }

    /**
     * Decodes the escape at {@code pos} (which points at the backslash) and advances past it.
     * Returns -1 for an unknown escape.
     */
    private int escape() {
        pos++; // backslash
        if (pos >= length) {
            return -1;
        }
        char c = buf[pos++];
        switch (c) {
            case 'n': return '\n';
            case 'r': return '\r';
            case 't': return '\t';
            case '0': return 0;
            case '\\': return '\\';
            case '"': return '"';
            case '\'': return '\'';
            case 'u': {
                if (peekChar(0) != '{') {
                    return -1;
                }
                int close = source.indexOf('}', pos);
                if (close < 0 || close == pos + 1 || close - pos > 7) {
                    return -1;
                }
                String hex = source.substring(pos + 1, close);
                try {
                    int codePoint = Integer.parseInt(hex, 16);
                    if (!Character.isValidCodePoint(codePoint)) {
                        return -1;
                    }
                    pos = close + 1;
                    return codePoint;
                } catch (NumberFormatException e) {
                    return -1;
                }
            }
            default:
                return -1;
        }
    }

    private Token withSuffix(Token literal) {
        if (literal.type() != TokenType.ERROR && pos < length && Character.isLetter(buf[pos])) {
            int start = pos;
            while (pos < length && isIdentifierPart(buf[pos])) {
                pos++;
            }
            pendingSuffix = make(TokenType.LITERAL_SUFFIX, start, pos, null);
        }
        return literal;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void skipPast(char terminator) {
        while (pos < length && buf[pos] != '\n') {
            if (buf[pos++] == terminator) {
                return;
            }
        }
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < length ? buf[index] : '\0';
    }

    private Token make(TokenType type, int start, int end, Object literal) {
        return new Token(type, source.substring(start, end), literal,
            startIndex + start, startIndex + end, line, start - lineStart);
    }

    private Token error(TokenizeError error, int start, int end) {
        return Token.error(new ParseError.Tokenize(error), startIndex + start, startIndex + end, line, start - lineStart);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
