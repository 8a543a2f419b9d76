package com.codeontology.core.graph;

/**
 * Object position of a {@link Triple}: either an {@link Iri} or a typed {@link Literal}.
 */
public interface RdfTerm {

    /**
     * Renders this term in N-Triples syntax.
     *
     * @return N-Triples text for this term
     */
    String toNTriples();
}
