package com.fnparser.ast;

public record Spanned<T>(Span span, T value) {

    public static <T> Spanned<T> of(int start, int end, T value) {
        return new Spanned<>(new Span(start, end), value);
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }
}
