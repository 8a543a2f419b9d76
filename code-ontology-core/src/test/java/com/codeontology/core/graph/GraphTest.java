package com.codeontology.core.graph;

import com.codeontology.core.graph.vocab.Rdf;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Graph}, {@link RdfLists} and {@link Literal}.
 */
class GraphTest {

    private static final Iri A = Iri.of("https://example.org/code#A");
    private static final Iri B = Iri.of("https://example.org/code#B");
    private static final Iri P = Iri.of("https://example.org/p");

    @Test
    void concat_duplicateTriples_keepsOneCopy() {
        Triple triple = Triples.link(A, P, B);

        Graph graph = Graph.concat(List.of(List.of(triple), List.of(triple, Triples.type(A, B))));

        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.contains(A, P, B)).isTrue();
    }

    @Test
    void merge_isOrderInsensitiveForEquality() {
        Graph left = Graph.of(List.of(Triples.link(A, P, B)));
        Graph right = Graph.of(List.of(Triples.type(A, B)));

        assertThat(left.merge(right)).isEqualTo(right.merge(left));
    }

    @Test
    void toNTriples_escapesLiterals() {
        Graph graph = Graph.of(List.of(Triples.value(A, P, Literal.string("say \"hi\"\n"))));

        assertThat(graph.toNTriples())
            .isEqualTo("<https://example.org/code#A> <https://example.org/p> \"say \\\"hi\\\"\\n\" .\n");
    }

    @Test
    void literal_typedValue_carriesDatatype() {
        assertThat(Literal.nonNegative(3).toNTriples())
            .isEqualTo("\"3\"^^<http://www.w3.org/2001/XMLSchema#nonNegativeInteger>");
        assertThat(Literal.of(true)).isEqualTo(Literal.bool(true));
        assertThat(Literal.of(2L)).isEqualTo(Literal.integer(2));
    }

    @Test
    void literal_negativeNonNegative_throwsException() {
        assertThatThrownBy(() -> Literal.nonNegative(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Literal.positive(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rdfList_buildAndRead_preservesOrder() {
        RdfList list = RdfLists.build(A, "params", List.of(B, A, B));
        Graph graph = Graph.of(list.triples());

        assertThat(list.head().value()).isEqualTo("https://example.org/code#A/params/0");
        assertThat(RdfLists.read(graph, list.head())).containsExactly(B, A, B);
        assertThat(graph.objects(A.resolve("/params/2"), Rdf.REST)).containsExactly(Rdf.NIL);
    }

    @Test
    void rdfList_empty_isNil() {
        RdfList list = RdfLists.build(A, "params", List.of());

        assertThat(list.head()).isEqualTo(Rdf.NIL);
        assertThat(list.triples()).isEmpty();
    }

    @Test
    void rdfList_read_malformedList_throwsException() {
        Graph graph = Graph.of(List.of(new Triple(A, Rdf.FIRST, B)));

        assertThatThrownBy(() -> RdfLists.read(graph, A))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    void tripleBuilder_nullOptionalValues_addNothing() {
        List<Triple> triples = new TripleBuilder()
            .string(A, P, null)
            .linkIfPresent(A, P, null)
            .positiveIfPresent(A, P, null)
            .flag(A, P, false)
            .build();

        assertThat(triples).isEmpty();
    }
}
