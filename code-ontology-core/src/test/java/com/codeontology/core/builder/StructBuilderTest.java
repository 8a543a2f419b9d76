package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.ExceptionInfo;
import com.codeontology.core.model.StructField;
import com.codeontology.core.model.StructInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StructBuilder}.
 */
class StructBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final StructBuilder builder = new StructBuilder();

    @Test
    void build_struct_sharesModuleIriAndEmitsFields() {
        StructInfo struct = new StructInfo("MyApp.User", List.of(
            new StructField("email", null, false, true),
            new StructField("name", "\"anonymous\"", true, false),
            new StructField("nickname", null, true, false)),
            List.of("Jason.Encoder"), null);

        BuildResult result = builder.build(struct, BuildContext.of(BASE));
        Graph graph = Graph.of(result.triples());
        Iri user = Iri.of(BASE + "MyApp.User");

        assertThat(result.iri()).isEqualTo(user);
        assertThat(graph.contains(user, Rdf.TYPE, Structure.STRUCT)).isTrue();
        assertThat(graph.contains(user, Structure.CONTAINS_STRUCT, user)).isTrue();
        assertThat(graph.objects(user, Structure.HAS_FIELD)).containsExactly(
            user.resolve("/field/email"), user.resolve("/field/name"), user.resolve("/field/nickname"));
        assertThat(graph.contains(user.resolve("/field/name"), Structure.HAS_DEFAULT_FIELD_VALUE,
            Literal.string("\"anonymous\""))).isTrue();
        assertThat(graph.contains(user.resolve("/field/nickname"), Structure.HAS_DEFAULT_FIELD_VALUE,
            Literal.string("nil"))).isTrue();
        assertThat(graph.objects(user.resolve("/field/email"), Structure.HAS_DEFAULT_FIELD_VALUE)).isEmpty();
        assertThat(graph.contains(user, Structure.DERIVES_PROTOCOL, Iri.of(BASE + "Jason.Encoder"))).isTrue();
    }

    @Test
    void build_enforcedKeys_areTypedAndLinked() {
        StructInfo struct = new StructInfo("S", List.of(new StructField("id", null, false, true)), List.of(), null);

        Graph graph = Graph.of(builder.build(struct, BuildContext.of(BASE)).triples());
        Iri field = Iri.of(BASE + "S/field/id");

        assertThat(graph.objects(field, Rdf.TYPE)).containsExactly(Structure.STRUCT_FIELD, Structure.ENFORCED_KEY);
        assertThat(graph.contains(Iri.of(BASE + "S"), Structure.HAS_ENFORCED_KEY, field)).isTrue();
    }

    @Test
    void buildException_recordsDefaultMessage() {
        ExceptionInfo exception = new ExceptionInfo("MyApp.NotFound",
            List.of(new StructField("message", "\"not found\"", true, false)), "\"not found\"", false, null);

        BuildResult result = builder.buildException(exception, BuildContext.of(BASE));
        Graph graph = Graph.of(result.triples());
        Iri iri = Iri.of(BASE + "MyApp.NotFound");

        assertThat(graph.contains(iri, Rdf.TYPE, Structure.EXCEPTION)).isTrue();
        assertThat(graph.contains(iri, Structure.EXCEPTION_MESSAGE, Literal.string("\"not found\""))).isTrue();
        assertThat(graph.contains(iri, Structure.HAS_FIELD, iri.resolve("/field/message"))).isTrue();
    }

    @Test
    void buildException_withoutDefaultMessage_omitsMessage() {
        ExceptionInfo exception = new ExceptionInfo("E", List.of(), null, true, null);

        Graph graph = Graph.of(builder.buildException(exception, BuildContext.of(BASE)).triples());

        assertThat(graph.objects(Iri.of(BASE + "E"), Structure.EXCEPTION_MESSAGE)).isEmpty();
    }
}
