package com.codeontology.core.graph;

import java.util.Objects;

/**
 * One subject-predicate-object statement.
 *
 * @param subject entity the statement is about
 * @param predicate property or relationship
 * @param object related entity or literal value
 */
public record Triple(Iri subject, Iri predicate, RdfTerm object) {

    /**
     * Compact constructor with validation.
     */
    public Triple {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(object, "object must not be null");
    }

    public String toNTriples() {
        return subject.toNTriples() + " " + predicate.toNTriples() + " " + object.toNTriples() + " .";
    }
}
