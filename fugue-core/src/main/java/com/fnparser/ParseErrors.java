package com.fnparser;

import com.fnparser.ast.Span;
import com.fnparser.ast.Spanned;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Errors in the order they were discovered. Duplicates are kept.
 */
public final class ParseErrors implements Iterable<Spanned<ParseError>> {

    private final List<Spanned<ParseError>> errors = new ArrayList<>();

    public void push(Span span, ParseError error) {
        errors.add(new Spanned<>(span, error));
    }

    public void push(Spanned<ParseError> error) {
        errors.add(error);
    }

    public void extend(ParseErrors other) {
        errors.addAll(other.errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public Spanned<ParseError> get(int index) {
        return errors.get(index);
    }

    public List<Spanned<ParseError>> asList() {
        return Collections.unmodifiableList(errors);
    }

    public Stream<Spanned<ParseError>> stream() {
        return errors.stream();
    }

    public List<Spanned<Diagnostic>> diagnostics() {
        return errors.stream()
            .map(e -> new Spanned<>(e.span(), e.value().asDiagnostic()))
            .collect(Collectors.toList());
    }

    @Override
    public Iterator<Spanned<ParseError>> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return errors.stream()
            .map(e -> e.span() + ": " + e.value().message())
            .collect(Collectors.joining("\n"));
    }
}
