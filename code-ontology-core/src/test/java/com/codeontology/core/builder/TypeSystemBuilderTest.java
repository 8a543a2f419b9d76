package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.RdfLists;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.FunctionSpecInfo;
import com.codeontology.core.model.SpecKind;
import com.codeontology.core.model.TypeDefinitionInfo;
import com.codeontology.core.model.TypeExpression;
import com.codeontology.core.model.TypeExpressionKind;
import com.codeontology.core.model.TypeVisibility;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TypeSystemBuilder}.
 */
class TypeSystemBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final TypeSystemBuilder builder = new TypeSystemBuilder();
    private final BuildContext context = BuildContext.of(BASE).withModule("MyApp.Users");

    private static final TypeExpression RESULT = new TypeExpression(TypeExpressionKind.UNION, null, null, List.of(
        new TypeExpression(TypeExpressionKind.TUPLE, null, null, List.of(
            new TypeExpression(TypeExpressionKind.LITERAL, ":ok", null, List.of(), ":ok"),
            TypeExpression.variable("value")), "{:ok, value}"),
        new TypeExpression(TypeExpressionKind.LITERAL, ":error", null, List.of(), ":error")),
        "{:ok, value} | :error");

    // ==================== Types ====================

    @Test
    void build_parameterizedUnionType_emitsStructure() {
        TypeDefinitionInfo type = new TypeDefinitionInfo("result", 1, TypeVisibility.PUBLIC, List.of("value"),
            RESULT, null);

        BuildResult result = builder.build(type, context);
        Graph graph = Graph.of(result.triples());
        Iri iri = Iri.of(BASE + "MyApp.Users/type/result/1");
        Iri body = iri.resolve("/expr");

        assertThat(result.iri()).isEqualTo(iri);
        assertThat(graph.contains(iri, Rdf.TYPE, Structure.PUBLIC_TYPE)).isTrue();
        assertThat(graph.contains(iri, Structure.TYPE_ARITY, Literal.nonNegative(1))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "MyApp.Users"), Structure.CONTAINS_TYPE, iri)).isTrue();
        assertThat(graph.contains(iri, Structure.HAS_TYPE_VARIABLE, iri.resolve("/var/value"))).isTrue();
        assertThat(graph.contains(iri, Structure.REFERENCES_TYPE, body)).isTrue();
        assertThat(graph.contains(body, Rdf.TYPE, Structure.UNION_TYPE)).isTrue();
        assertThat(graph.objects(body, Structure.UNION_OF))
            .containsExactly(body.resolve("/elem/0"), body.resolve("/elem/1"));
        assertThat(graph.contains(body.resolve("/elem/0"), Rdf.TYPE, Structure.TUPLE_TYPE)).isTrue();
        assertThat(graph.contains(body.resolve("/elem/0/elem/1"), Core.NAME, Literal.string("value"))).isTrue();
        assertThat(graph.contains(body, Structure.TYPE_EXPRESSION_TEXT, Literal.string("{:ok, value} | :error")))
            .isTrue();
    }

    @Test
    void build_opaqueAndPrivateTypes_useVisibilityClass() {
        TypeDefinitionInfo opaque = new TypeDefinitionInfo("t", 0, TypeVisibility.OPAQUE, List.of(),
            TypeExpression.basic("map"), null);
        TypeDefinitionInfo secret = new TypeDefinitionInfo("s", 0, TypeVisibility.PRIVATE, List.of(), null, null);

        Graph graph = Graph.of(builder.build(opaque, context).triples())
            .merge(Graph.of(builder.build(secret, context).triples()));

        assertThat(graph.contains(Iri.of(BASE + "MyApp.Users/type/t/0"), Rdf.TYPE, Structure.OPAQUE_TYPE)).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "MyApp.Users/type/s/0"), Rdf.TYPE, Structure.PRIVATE_TYPE)).isTrue();
        assertThat(graph.objects(Iri.of(BASE + "MyApp.Users/type/s/0"), Structure.REFERENCES_TYPE)).isEmpty();
    }

    // ==================== Specs ====================

    @Test
    void buildSpec_functionSpec_hangsOffFunction() {
        TypeExpression string = new TypeExpression(TypeExpressionKind.REMOTE, "t", "String", List.of(), "String.t()");
        FunctionSpecInfo spec = new FunctionSpecInfo("get", 1, SpecKind.SPEC, List.of(string), RESULT, List.of(),
            false, null);

        BuildResult result = builder.buildSpec(spec, context);
        Graph graph = Graph.of(result.triples());
        Iri function = Iri.of(BASE + "MyApp.Users/get/1");
        Iri iri = function.resolve("/spec");

        assertThat(result.iri()).isEqualTo(iri);
        assertThat(graph.contains(function, Structure.HAS_SPEC, iri)).isTrue();
        assertThat(graph.contains(iri, Rdf.TYPE, Structure.FUNCTION_SPEC)).isTrue();
        Iri params = (Iri) graph.objects(iri, Structure.HAS_PARAMETER_TYPE).get(0);
        assertThat(RdfLists.read(graph, params)).containsExactly(iri.resolve("/param/0"));
        assertThat(graph.contains(iri.resolve("/param/0"), Structure.REFERENCES_TYPE,
            Iri.of(BASE + "String/type/t/0"))).isTrue();
        assertThat(graph.contains(iri, Structure.HAS_RETURN_TYPE, iri.resolve("/return"))).isTrue();
    }

    @Test
    void buildSpec_zeroArity_hasEmptyParameterList() {
        FunctionSpecInfo spec = new FunctionSpecInfo("now", 0, SpecKind.SPEC, List.of(),
            TypeExpression.basic("integer"), List.of(), false, null);

        Graph graph = Graph.of(builder.buildSpec(spec, context).triples());

        assertThat(graph.objects(Iri.of(BASE + "MyApp.Users/now/0/spec"), Structure.HAS_PARAMETER_TYPE))
            .containsExactly(Rdf.NIL);
    }

    @Test
    void buildSpec_optionalCallback_hangsOffCallbackWithVariables() {
        FunctionSpecInfo spec = new FunctionSpecInfo("handle", 1, SpecKind.CALLBACK,
            List.of(TypeExpression.variable("t")), TypeExpression.variable("t"), List.of("t"), true, null);

        Graph graph = Graph.of(builder.buildSpec(spec, context).triples());
        Iri callback = Iri.of(BASE + "MyApp.Users/callback/handle/1");
        Iri iri = callback.resolve("/spec");

        assertThat(graph.contains(callback, Structure.HAS_SPEC, iri)).isTrue();
        assertThat(graph.objects(iri, Rdf.TYPE))
            .containsExactly(Structure.CALLBACK_SPEC, Structure.OPTIONAL_CALLBACK_SPEC);
        assertThat(graph.contains(iri, Structure.HAS_TYPE_VARIABLE, iri.resolve("/var/t"))).isTrue();
    }

    @Test
    void buildSpec_withoutModule_throwsException() {
        FunctionSpecInfo spec = new FunctionSpecInfo("f", 0, SpecKind.SPEC, List.of(), null, List.of(), false, null);

        assertThatThrownBy(() -> builder.buildSpec(spec, BuildContext.of(BASE)))
            .isInstanceOf(IllegalStateException.class);
    }
}
