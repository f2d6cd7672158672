package com.fnparser;

public enum TokenType {
    // Names
    IDENTIFIER("identifier"),
    OPERATOR("operator"),

    // Keywords
    LET("let", true),
    IN("in", true),
    TYPE("type", true),
    MATCH("match", true),
    WITH("with", true),
    IF("if", true),
    THEN("then", true),
    ELSE("else", true),
    DO("do", true),

    // Literals
    INT("integer"),
    BYTE("byte"),
    FLOAT("float"),
    STRING("string"),
    CHAR("char"),
    LITERAL_SUFFIX("literal suffix"),

    // Punctuation
    LPAREN("(", true),
    RPAREN(")", true),
    LBRACKET("[", true),
    RBRACKET("]", true),
    LBRACE("{", true),
    RBRACE("}", true),
    COMMA(",", true),
    SEMICOLON(";", true),
    DOT(".", true),
    EQUALS("=", true),
    ARROW("->", true),
    BACKSLASH("\\", true),
    PIPE("|", true),
    COLON(":", true),
    ATTRIBUTE_OPEN("#[", true),

    DOC_COMMENT("doc comment"),

    // Inserted by the layout engine
    OPEN_BLOCK("<block>"),
    CLOSE_BLOCK("<end of block>"),
    SEPARATOR("<separator>"),

    ERROR("error"),
    EOF("end of file");

    private final String display;
    private final boolean fixedSpelling;

    TokenType(String display) {
        this(display, false);
    }

    TokenType(String display, boolean fixedSpelling) {
        this.display = display;
        this.fixedSpelling = fixedSpelling;
    }

    /**
     * Human readable name; the spelling itself for keywords and punctuation.
     */
    public String display() {
        return display;
    }

    /**
     * The terminal as the grammar names it in its expectation sets, including the quotes.
     */
    public String terminal() {
        return "\"" + display + "\"";
    }

    public boolean isKeyword() {
        return fixedSpelling && Character.isLetter(display.charAt(0));
    }

    public boolean isLayout() {
        return this == OPEN_BLOCK || this == CLOSE_BLOCK || this == SEPARATOR;
    }

    public boolean isLiteral() {
        return this == INT || this == BYTE || this == FLOAT || this == STRING || this == CHAR;
    }

    /**
     * Tokens after which a block may start on the following, further indented line.
     */
    public boolean opensBlock() {
        return this == EQUALS || this == ARROW || this == THEN || this == ELSE || this == IN || this == WITH;
    }

    /**
     * Tokens that continue the construct of the previous line even when they start a line at
     * the block's own column.
     */
    public boolean continuesLine() {
        return this == IN || this == THEN || this == ELSE || this == WITH || this == PIPE || isCloser();
    }

    public boolean isOpener() {
        return this == LPAREN || this == LBRACKET || this == LBRACE || this == ATTRIBUTE_OPEN;
    }

    public boolean isCloser() {
        return this == RPAREN || this == RBRACKET || this == RBRACE;
    }

    static TokenType keyword(String word) {
        return switch (word) {
            case "let" -> LET;
            case "in" -> IN;
            case "type" -> TYPE;
            case "match" -> MATCH;
            case "with" -> WITH;
            case "if" -> IF;
            case "then" -> THEN;
            case "else" -> ELSE;
            case "do" -> DO;
            default -> null;
        };
    }
}
