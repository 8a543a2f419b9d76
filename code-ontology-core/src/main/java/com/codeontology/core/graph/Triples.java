package com.codeontology.core.graph;

import com.codeontology.core.graph.vocab.Rdf;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Static helpers for constructing individual triples.
 */
public final class Triples {

    private Triples() {
        // Utility class - no instantiation
    }

    public static Triple type(Iri subject, Iri rdfClass) {
        return new Triple(subject, Rdf.TYPE, rdfClass);
    }

    public static Triple link(Iri subject, Iri predicate, Iri object) {
        return new Triple(subject, predicate, object);
    }

    public static Triple value(Iri subject, Iri predicate, Literal value) {
        return new Triple(subject, predicate, value);
    }

    /**
     * Types a subject with a base class and a refinement of it.
     *
     * @param subject subject
     * @param baseClass general class
     * @param specializedClass refining class
     * @return both type triples
     */
    public static List<Triple> dualType(Iri subject, Iri baseClass, Iri specializedClass) {
        return List.of(type(subject, baseClass), type(subject, specializedClass));
    }

    /**
     * Concatenates triple lists, dropping duplicates and keeping first-occurrence order.
     *
     * @param parts triple lists
     * @return flattened, duplicate-free list
     */
    public static List<Triple> distinct(Collection<? extends Collection<Triple>> parts) {
        LinkedHashSet<Triple> all = new LinkedHashSet<>();
        for (Collection<Triple> part : parts) {
            all.addAll(part);
        }
        return List.copyOf(all);
    }
}
