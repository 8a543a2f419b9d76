package com.codeontology.core.graph;

import com.codeontology.core.graph.vocab.Rdf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Encodes ordered collections as RDF lists.
 *
 * <p>A triple store has no notion of sequence, so parameter and clause order is kept as a
 * chain of nodes: {@code node_i rdf:first item_i} and {@code node_i rdf:rest node_i+1}, the
 * last node pointing to {@code rdf:nil}. List nodes are named {@code {owner}/{label}/{i}} so
 * identical input always produces identical nodes. A list of {@code n} items yields exactly
 * {@code 2n} triples; the empty list is the {@code rdf:nil} sentinel with no triples. The
 * caller adds the single triple referencing {@link RdfList#head()}.
 */
public final class RdfLists {

    private RdfLists() {
        // Utility class - no instantiation
    }

    /**
     * Builds the list encoding of {@code items}.
     *
     * @param owner entity owning the list; list node IRIs derive from it
     * @param label name distinguishing several lists of one owner
     * @param items elements in order
     * @return list head and triples
     */
    public static RdfList build(Iri owner, String label, List<? extends RdfTerm> items) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (items == null || items.isEmpty()) {
            return new RdfList(Rdf.NIL, List.of());
        }
        List<Triple> triples = new ArrayList<>(items.size() * 2);
        for (int i = 0; i < items.size(); i++) {
            Iri node = node(owner, label, i);
            Iri rest = i + 1 < items.size() ? node(owner, label, i + 1) : Rdf.NIL;
            triples.add(new Triple(node, Rdf.FIRST, items.get(i)));
            triples.add(new Triple(node, Rdf.REST, rest));
        }
        return new RdfList(node(owner, label, 0), triples);
    }

    /**
     * Reads a list back from a graph.
     *
     * @param graph graph containing the list
     * @param head list head
     * @return elements in order
     */
    public static List<RdfTerm> read(Graph graph, Iri head) {
        List<RdfTerm> items = new ArrayList<>();
        Iri current = head;
        while (!Rdf.NIL.equals(current)) {
            List<RdfTerm> first = graph.objects(current, Rdf.FIRST);
            List<RdfTerm> rest = graph.objects(current, Rdf.REST);
            if (first.size() != 1 || rest.size() != 1 || !(rest.get(0) instanceof Iri next)) {
                throw new IllegalArgumentException("Malformed RDF list at " + current);
            }
            items.add(first.get(0));
            current = next;
        }
        return items;
    }

    private static Iri node(Iri owner, String label, int index) {
        return owner.resolve("/" + label + "/" + index);
    }
}
