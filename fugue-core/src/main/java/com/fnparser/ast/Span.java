package com.fnparser.ast;

/**
 * Half-open range {@code [start, end)} of source offsets.
 */
public record Span(int start, int end) {

    public Span {
        if (end < start) {
            throw new IllegalArgumentException("Span end " + end + " is before start " + start);
        }
    }

    public static Span at(int position) {
        return new Span(position, position);
    }

    public Span withEnd(int newEnd) {
        return new Span(start, newEnd);
    }

    public Span merge(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
