package com.codeontology.core.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable set of triples.
 *
 * <p>Duplicates collapse on construction; iteration follows first-insertion order so that a
 * deterministic pipeline yields a byte-identical serialisation.
 */
public final class Graph {

    private static final Graph EMPTY = new Graph(new LinkedHashSet<>());

    private final Set<Triple> triples;

    private Graph(LinkedHashSet<Triple> triples) {
        this.triples = Collections.unmodifiableSet(triples);
    }

    public static Graph empty() {
        return EMPTY;
    }

    /**
     * Creates a graph from triples, dropping duplicates.
     *
     * @param triples triples in any order
     * @return graph
     */
    public static Graph of(Collection<Triple> triples) {
        Objects.requireNonNull(triples, "triples must not be null");
        return new Graph(new LinkedHashSet<>(triples));
    }

    /**
     * Creates a graph from several triple lists.
     *
     * @param parts triple lists concatenated in order
     * @return graph
     */
    public static Graph concat(List<? extends Collection<Triple>> parts) {
        LinkedHashSet<Triple> all = new LinkedHashSet<>();
        for (Collection<Triple> part : parts) {
            all.addAll(part);
        }
        return new Graph(all);
    }

    /**
     * Returns a graph containing the triples of both graphs.
     *
     * @param other graph to merge
     * @return merged graph
     */
    public Graph merge(Graph other) {
        LinkedHashSet<Triple> all = new LinkedHashSet<>(triples);
        all.addAll(other.triples);
        return new Graph(all);
    }

    public Set<Triple> triples() {
        return triples;
    }

    public int size() {
        return triples.size();
    }

    public boolean isEmpty() {
        return triples.isEmpty();
    }

    public boolean contains(Triple triple) {
        return triples.contains(triple);
    }

    public boolean contains(Iri subject, Iri predicate, RdfTerm object) {
        return triples.contains(new Triple(subject, predicate, object));
    }

    public Stream<Triple> stream() {
        return triples.stream();
    }

    /**
     * Returns the triples matching a predicate.
     *
     * @param filter triple filter
     * @return matching triples in graph order
     */
    public List<Triple> filter(Predicate<Triple> filter) {
        return triples.stream().filter(filter).toList();
    }

    /**
     * Returns all distinct subjects.
     *
     * @return subjects in first-occurrence order
     */
    public Set<Iri> subjects() {
        return triples.stream()
            .map(Triple::subject)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Returns the objects of all triples with the given subject and predicate.
     *
     * @param subject subject IRI
     * @param predicate predicate IRI
     * @return objects in graph order
     */
    public List<RdfTerm> objects(Iri subject, Iri predicate) {
        return triples.stream()
            .filter(t -> t.subject().equals(subject) && t.predicate().equals(predicate))
            .map(Triple::object)
            .toList();
    }

    /**
     * Returns the subjects typed with the given class.
     *
     * @param typePredicate the {@code rdf:type} predicate
     * @param type class IRI
     * @return subjects in graph order
     */
    public List<Iri> subjectsOfType(Iri typePredicate, Iri type) {
        return triples.stream()
            .filter(t -> t.predicate().equals(typePredicate) && t.object().equals(type))
            .map(Triple::subject)
            .toList();
    }

    /**
     * Serialises the graph as N-Triples, one statement per line.
     *
     * @return N-Triples document
     */
    public String toNTriples() {
        StringBuilder sb = new StringBuilder();
        for (Triple triple : triples) {
            sb.append(triple.toNTriples()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Graph other)) {
            return false;
        }
        return triples.equals(other.triples);
    }

    @Override
    public int hashCode() {
        return triples.hashCode();
    }

    @Override
    public String toString() {
        return "Graph[" + triples.size() + " triples]";
    }
}
