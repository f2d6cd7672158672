package com.fnparser.ast;

import java.util.List;
import java.util.Optional;

/**
 * Documentation and attributes attached to a binding.
 */
public record Metadata(String comment, List<Attribute> attributes) {

    public static final Metadata EMPTY = new Metadata(null, List.of());

    public Metadata {
        attributes = List.copyOf(attributes);
    }

    public Optional<String> getAttribute(String name) {
        for (Attribute attribute : attributes) {
            if (attribute.name().equals(name)) {
                return Optional.of(attribute.arguments() != null ? attribute.arguments() : "");
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return comment == null && attributes.isEmpty();
    }
}
