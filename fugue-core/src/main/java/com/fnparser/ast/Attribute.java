package com.fnparser.ast;

/**
 * A {@code #[name(arguments)]} attribute. {@code arguments} is the raw text between the
 * parentheses, or null when the attribute has none.
 */
public record Attribute(String name, String arguments) {
}
