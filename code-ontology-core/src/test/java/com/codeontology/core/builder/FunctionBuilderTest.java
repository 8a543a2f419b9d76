package com.codeontology.core.builder;

import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.extractor.ExtractionScope;
import com.codeontology.core.extractor.FunctionExtractor;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.RdfLists;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.FunctionInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FunctionBuilder} and {@link ClauseBuilder}.
 */
class FunctionBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final FunctionBuilder builder = new FunctionBuilder();
    private final BuildContext context = BuildContext.of(BASE).withModule("M");

    private static FunctionInfo extracted(SyntaxNode... definitions) {
        return new FunctionExtractor().extract(List.of(definitions), ExtractionScope.of("M")).get(0);
    }

    @Test
    void build_publicFunction_emitsTypeArityAndMembership() {
        FunctionInfo info = extracted(def("f", List.of(var("x")), call("g")));

        BuildResult result = builder.build(info, context);
        Graph graph = Graph.of(result.triples());
        Iri f = Iri.of(BASE + "M/f/1");

        assertThat(result.iri()).isEqualTo(f);
        assertThat(graph.contains(f, Rdf.TYPE, Structure.PUBLIC_FUNCTION)).isTrue();
        assertThat(graph.contains(f, Structure.FUNCTION_NAME, Literal.string("f"))).isTrue();
        assertThat(graph.contains(f, Structure.ARITY, Literal.nonNegative(1))).isTrue();
        assertThat(graph.contains(f, Structure.BELONGS_TO, Iri.of(BASE + "M"))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "M"), Structure.CONTAINS_FUNCTION, f)).isTrue();
        assertThat(graph.objects(f, Structure.MIN_ARITY)).isEmpty();
    }

    @Test
    void build_clauses_areOrderedWithParameterLists() {
        FunctionInfo info = extracted(
            def("fact", List.of(integer(0)), integer(1)),
            def("fact", List.of(var("n")), var("n")));

        Graph graph = Graph.of(builder.build(info, context).triples());
        Iri fact = Iri.of(BASE + "M/fact/1");
        Iri first = fact.resolve("/clause/0");
        Iri second = fact.resolve("/clause/1");

        assertThat(graph.objects(fact, Structure.HAS_CLAUSE)).containsExactly(first, second);
        assertThat(graph.contains(first, Structure.CLAUSE_ORDER, Literal.positive(1))).isTrue();
        assertThat(graph.contains(second, Structure.CLAUSE_ORDER, Literal.positive(2))).isTrue();
        Iri head = second.resolve("/head");
        Iri params = (Iri) graph.objects(head, Structure.HAS_PARAMETERS).get(0);
        assertThat(RdfLists.read(graph, params)).containsExactly(second.resolve("/param/0"));
        assertThat(graph.contains(second.resolve("/param/0"), Rdf.TYPE, Structure.PARAMETER)).isTrue();
        assertThat(graph.contains(first.resolve("/param/0"), Rdf.TYPE, Structure.PATTERN_PARAMETER)).isTrue();
        assertThat(graph.contains(second.resolve("/param/0"), Structure.PARAMETER_NAME, Literal.string("n"))).isTrue();
    }

    @Test
    void build_zeroArity_hasEmptyParameterList() {
        Graph graph = Graph.of(builder.build(extracted(def("g", List.of(), atom("ok"))), context).triples());

        Iri head = Iri.of(BASE + "M/g/0/clause/0/head");
        assertThat(graph.objects(head, Structure.HAS_PARAMETERS)).containsExactly(Rdf.NIL);
    }

    @Test
    void build_defaultArgument_emitsMinArityAndDefaultParameter() {
        FunctionInfo info = extracted(def("greet",
            List.of(var("name"), op("\\\\", var("greeting"), string("Hi"))), var("greeting")));

        Graph graph = Graph.of(builder.build(info, context).triples());
        Iri greet = Iri.of(BASE + "M/greet/2");
        Iri param = greet.resolve("/clause/0/param/1");

        assertThat(graph.contains(greet, Structure.MIN_ARITY, Literal.nonNegative(1))).isTrue();
        assertThat(graph.contains(param, Rdf.TYPE, Structure.DEFAULT_PARAMETER)).isTrue();
        assertThat(graph.contains(param, Structure.HAS_DEFAULT_VALUE, Literal.string("\"Hi\""))).isTrue();
    }

    @Test
    void build_privateMacroAndDelegate_useSpecificClasses() {
        FunctionInfo macro = extracted(function("defmacrop", "m", List.of(), null, atom("ok")));
        FunctionInfo delegate = extracted(defdelegate("size", List.of(var("l")), "Enum", "count"));

        Graph macroGraph = Graph.of(builder.build(macro, context).triples());
        Graph delegateGraph = Graph.of(builder.build(delegate, context).triples());

        assertThat(macroGraph.contains(Iri.of(BASE + "M/m/0"), Rdf.TYPE, Structure.PRIVATE_MACRO)).isTrue();
        assertThat(macroGraph.contains(Iri.of(BASE + "M"), Structure.CONTAINS_MACRO, Iri.of(BASE + "M/m/0"))).isTrue();
        assertThat(delegateGraph.contains(Iri.of(BASE + "M/size/1"), Structure.DELEGATES_TO,
            Iri.of(BASE + "Enum/count/1"))).isTrue();
    }

    @Test
    void build_guardWithoutExpressions_emitsPlaceholderGuard() {
        FunctionInfo info = extracted(function("def", "pos", List.of(var("n")), op(">", var("n"), integer(0)), var("n")));

        Graph graph = Graph.of(builder.build(info, context).triples());
        Iri head = Iri.of(BASE + "M/pos/1/clause/0/head");

        assertThat(graph.contains(head, Core.HAS_GUARD, head.resolve("/guard"))).isTrue();
        assertThat(graph.contains(head.resolve("/guard"), Rdf.TYPE, Core.GUARD_CLAUSE)).isTrue();
    }

    @Test
    void build_withExpressions_advancesCounterAcrossClauses() {
        FunctionInfo info = extracted(
            def("h", List.of(integer(0)), atom("zero")),
            def("h", List.of(var("n")), var("n")));
        BuildContext withExpressions = context.withConfig(Map.of(BuildContext.INCLUDE_EXPRESSIONS, true));

        BuildResult result = builder.build(info, withExpressions);
        Graph graph = Graph.of(result.triples());

        assertThat(result.context().counter()).isEqualTo(2);
        assertThat(graph.objects(Iri.of(BASE + "M/h/1/clause/0/body"), Core.HAS_OPERAND))
            .containsExactly(Iri.of(BASE + "expr/M/0"));
        assertThat(graph.objects(Iri.of(BASE + "M/h/1/clause/1/body"), Core.HAS_OPERAND))
            .doesNotContain(Iri.of(BASE + "expr/M/0"));
    }

    @Test
    void build_withoutModule_throwsException() {
        FunctionInfo info = extracted(def("f", List.of(), atom("ok")));

        assertThatThrownBy(() -> builder.build(info, BuildContext.of(BASE)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("requires module context");
    }
}
