package com.codeontology.core.builder;

import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.extractor.AnonymousFunctionExtractor;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.RdfLists;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.AnonymousFunctionInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AnonymousFunctionBuilder} and {@link ClosureBuilder}.
 */
class AnonymousFunctionBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final AnonymousFunctionBuilder builder = new AnonymousFunctionBuilder();
    private final BuildContext context = BuildContext.of(BASE).withModule("M");

    private static AnonymousFunctionInfo firstAnonymous(SyntaxNode... statements) {
        return new AnonymousFunctionExtractor().extract(List.of(statements)).get(0);
    }

    @Test
    void build_fnInsideFunction_linksEnclosingFunctionAndCaptures() {
        // def scale(items, factor), do: Enum.map(items, fn x -> x * factor end)
        AnonymousFunctionInfo info = firstAnonymous(def("scale", List.of(var("items"), var("factor")),
            remoteCall("Enum", "map", var("items"), fn(clause(List.of(var("x")), null,
                op("*", var("x"), var("factor")))))));

        BuildResult result = builder.build(info, context);
        Graph graph = Graph.of(result.triples());
        Iri anonymous = Iri.of(BASE + "M/anon/0");
        Iri captured = anonymous.resolve("/capture/factor");

        assertThat(result.iri()).isEqualTo(anonymous);
        assertThat(graph.contains(anonymous, Rdf.TYPE, Structure.ANONYMOUS_FUNCTION)).isTrue();
        assertThat(graph.contains(anonymous, Structure.ARITY, Literal.nonNegative(1))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "M/scale/2"), Structure.CONTAINS_ANONYMOUS_FUNCTION, anonymous))
            .isTrue();
        assertThat(graph.objects(anonymous, Core.CAPTURES_VARIABLE)).containsExactly(captured);
        assertThat(graph.contains(captured, Rdf.TYPE, Core.VARIABLE)).isTrue();
        assertThat(graph.contains(captured, Core.NAME, Literal.string("factor"))).isTrue();
    }

    @Test
    void build_singleClause_hasNoClauseList() {
        AnonymousFunctionInfo info = firstAnonymous(def("f", List.of(), fn(clause(List.of(), null, atom("ok")))));

        Graph graph = Graph.of(builder.build(info, context).triples());
        Iri anonymous = Iri.of(BASE + "M/anon/0");

        assertThat(graph.objects(anonymous, Structure.HAS_CLAUSE)).containsExactly(anonymous.resolve("/clause/0"));
        assertThat(graph.objects(anonymous, Structure.HAS_CLAUSES)).isEmpty();
        assertThat(graph.objects(anonymous, Core.CAPTURES_VARIABLE)).isEmpty();
    }

    @Test
    void build_multipleClauses_areOrderedInList() {
        AnonymousFunctionInfo info = firstAnonymous(def("f", List.of(), fn(
            clause(List.of(atom("ok")), null, integer(1)),
            clause(List.of(var("other")), call("is_atom", var("other")), integer(2)))));

        Graph graph = Graph.of(builder.build(info, context).triples());
        Iri anonymous = Iri.of(BASE + "M/anon/0");
        Iri second = anonymous.resolve("/clause/1");
        Iri head = (Iri) graph.objects(anonymous, Structure.HAS_CLAUSES).get(0);

        assertThat(RdfLists.read(graph, head)).containsExactly(anonymous.resolve("/clause/0"), second);
        assertThat(graph.contains(second, Structure.CLAUSE_ORDER, Literal.positive(2))).isTrue();
        assertThat(graph.contains(second, Core.HAS_GUARD, Literal.bool(true))).isTrue();
        assertThat(graph.objects(anonymous.resolve("/clause/0"), Core.HAS_GUARD)).isEmpty();
    }

    @Test
    void build_moduleLevelFn_isContainedByModule() {
        AnonymousFunctionInfo info = new AnonymousFunctionInfo(3, List.of(), null, null, null);

        Graph graph = Graph.of(builder.build(info, context).triples());

        assertThat(graph.contains(Iri.of(BASE + "M"), Structure.CONTAINS_ANONYMOUS_FUNCTION,
            Iri.of(BASE + "M/anon/3"))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "M/anon/3"), Structure.ARITY, Literal.nonNegative(0))).isTrue();
    }

    @Test
    void build_withoutModule_throwsException() {
        AnonymousFunctionInfo info = new AnonymousFunctionInfo(0, List.of(), null, null, null);

        assertThatThrownBy(() -> builder.build(info, BuildContext.of(BASE)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("AnonymousFunctionBuilder");
    }
}
