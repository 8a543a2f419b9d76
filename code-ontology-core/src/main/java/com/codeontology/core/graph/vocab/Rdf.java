package com.codeontology.core.graph.vocab;

import com.codeontology.core.graph.Iri;

/**
 * RDF built-in vocabulary.
 */
public final class Rdf {

    public static final String NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

    public static final Iri TYPE = new Iri(NS + "type");
    public static final Iri FIRST = new Iri(NS + "first");
    public static final Iri REST = new Iri(NS + "rest");
    /** Empty-list sentinel */
    public static final Iri NIL = new Iri(NS + "nil");

    private Rdf() {
        // Utility class - no instantiation
    }
}
