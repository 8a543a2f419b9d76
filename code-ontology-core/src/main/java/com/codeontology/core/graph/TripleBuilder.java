package com.codeontology.core.graph;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates the triples of one build call.
 *
 * <p>Each builder invocation creates its own instance; instances are never shared between
 * threads. Optional values ({@code null} strings, absent IRIs, false flags) emit nothing,
 * so callers do not have to guard every property. {@link #build()} returns the triples in
 * first-insertion order without duplicates.
 *
 * <pre>{@code
 * List<Triple> triples = new TripleBuilder()
 *     .type(functionIri, Structure.PUBLIC_FUNCTION)
 *     .string(functionIri, Structure.FUNCTION_NAME, "get_user")
 *     .string(functionIri, Structure.DOCSTRING, docOrNull)
 *     .build();
 * }</pre>
 */
public final class TripleBuilder {

    private final LinkedHashSet<Triple> triples = new LinkedHashSet<>();

    public TripleBuilder add(Triple triple) {
        triples.add(Objects.requireNonNull(triple, "triple must not be null"));
        return this;
    }

    public TripleBuilder addAll(Collection<Triple> more) {
        triples.addAll(more);
        return this;
    }

    public TripleBuilder type(Iri subject, Iri rdfClass) {
        return add(Triples.type(subject, rdfClass));
    }

    public TripleBuilder link(Iri subject, Iri predicate, Iri object) {
        return add(Triples.link(subject, predicate, object));
    }

    /**
     * Adds a relationship if the object is present.
     *
     * @param subject subject
     * @param predicate predicate
     * @param object object, or null to add nothing
     * @return this builder
     */
    public TripleBuilder linkIfPresent(Iri subject, Iri predicate, Iri object) {
        if (object != null) {
            link(subject, predicate, object);
        }
        return this;
    }

    /**
     * Adds the relationship in both directions.
     *
     * @param child child entity
     * @param toParent child-to-parent predicate
     * @param parent parent entity
     * @param toChild parent-to-child predicate
     * @return this builder
     */
    public TripleBuilder bidirectional(Iri child, Iri toParent, Iri parent, Iri toChild) {
        link(child, toParent, parent);
        return link(parent, toChild, child);
    }

    public TripleBuilder value(Iri subject, Iri predicate, Literal literal) {
        return add(Triples.value(subject, predicate, literal));
    }

    /**
     * Adds a string property unless the value is null.
     *
     * @param subject subject
     * @param predicate predicate
     * @param value value, or null to add nothing
     * @return this builder
     */
    public TripleBuilder string(Iri subject, Iri predicate, String value) {
        if (value != null) {
            value(subject, predicate, Literal.string(value));
        }
        return this;
    }

    public TripleBuilder bool(Iri subject, Iri predicate, boolean value) {
        return value(subject, predicate, Literal.bool(value));
    }

    /**
     * Adds a {@code true} boolean property only when the flag is set.
     *
     * @param subject subject
     * @param predicate predicate
     * @param flag whether to add the triple
     * @return this builder
     */
    public TripleBuilder flag(Iri subject, Iri predicate, boolean flag) {
        if (flag) {
            bool(subject, predicate, true);
        }
        return this;
    }

    public TripleBuilder nonNegative(Iri subject, Iri predicate, int value) {
        return value(subject, predicate, Literal.nonNegative(value));
    }

    public TripleBuilder positive(Iri subject, Iri predicate, int value) {
        return value(subject, predicate, Literal.positive(value));
    }

    /**
     * Adds a positive integer property unless the value is null.
     *
     * @param subject subject
     * @param predicate predicate
     * @param value value, or null to add nothing
     * @return this builder
     */
    public TripleBuilder positiveIfPresent(Iri subject, Iri predicate, Integer value) {
        if (value != null) {
            positive(subject, predicate, value);
        }
        return this;
    }

    public int size() {
        return triples.size();
    }

    public List<Triple> build() {
        return List.copyOf(triples);
    }
}
