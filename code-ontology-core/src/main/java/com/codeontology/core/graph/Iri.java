package com.codeontology.core.graph;

import java.util.Objects;

/**
 * Internationalized resource identifier naming a graph entity or vocabulary term.
 *
 * @param value absolute IRI text
 */
public record Iri(String value) implements RdfTerm {

    /**
     * Compact constructor with validation.
     */
    public Iri {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("IRI must not be blank");
        }
    }

    public static Iri of(String value) {
        return new Iri(value);
    }

    /**
     * Appends a raw suffix to this IRI.
     *
     * @param suffix text appended verbatim
     * @return new IRI
     */
    public Iri resolve(String suffix) {
        return new Iri(value + suffix);
    }

    @Override
    public String toNTriples() {
        return "<" + value + ">";
    }

    @Override
    public String toString() {
        return value;
    }
}
