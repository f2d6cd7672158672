package com.fnparser.ast;

/**
 * A literal constant. {@code value} is a {@code Long} (INT), a {@code Short} in 0..255 (BYTE), a
 * {@code Double} (FLOAT), a {@code String} (STRING) or an {@code Integer} code point (CHAR). The node span covers the
 * optional suffix, which keeps its own span.
 */
public record Literal(
    int start,
    int end,
    LiteralKind kind,
    Object value,
    String raw,
    Spanned<String> suffix  // null when the literal has no suffix
) implements Expression {

    public Literal(int start, int end, LiteralKind kind, Object value, String raw) {
        this(start, end, kind, value, raw, null);
    }

    @Override
    public String type() {
        return "Literal";
    }
}
