package com.codeontology.core.graph;

import java.util.List;
import java.util.Objects;

/**
 * Linked-list encoding of an ordered collection.
 *
 * @param head first list node, or {@code rdf:nil} for an empty list
 * @param triples {@code rdf:first}/{@code rdf:rest} triples, two per element
 */
public record RdfList(Iri head, List<Triple> triples) {

    /**
     * Compact constructor with validation.
     */
    public RdfList {
        Objects.requireNonNull(head, "head must not be null");
        triples = triples != null ? List.copyOf(triples) : List.of();
    }
}
