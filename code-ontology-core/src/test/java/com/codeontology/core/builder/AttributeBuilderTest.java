package com.codeontology.core.builder;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.AttributeInfo;
import com.codeontology.core.model.AttributeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AttributeBuilder}.
 */
class AttributeBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final AttributeBuilder builder = new AttributeBuilder();
    private final BuildContext context = BuildContext.of(BASE).withModule("MyApp");

    @Test
    void build_customAttribute_isModuleAttributeWithValue() {
        AttributeInfo attribute = new AttributeInfo("timeout", null, "5000", false, false, 2, null);

        BuildResult result = builder.build(attribute, context);
        Graph graph = Graph.of(result.triples());
        Iri iri = Iri.of(BASE + "MyApp/attribute/timeout/2");

        assertThat(result.iri()).isEqualTo(iri);
        assertThat(graph.contains(iri, Rdf.TYPE, Structure.MODULE_ATTRIBUTE)).isTrue();
        assertThat(graph.contains(iri, Structure.ATTRIBUTE_NAME, Literal.string("timeout"))).isTrue();
        assertThat(graph.contains(iri, Structure.ATTRIBUTE_VALUE, Literal.string("5000"))).isTrue();
        assertThat(graph.contains(iri, Structure.BELONGS_TO, Iri.of(BASE + "MyApp"))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "MyApp"), Structure.HAS_ATTRIBUTE, iri)).isTrue();
        assertThat(graph.objects(iri, Structure.IS_ACCUMULATING)).isEmpty();
    }

    @Test
    void build_deprecated_recordsMessage() {
        AttributeInfo attribute = new AttributeInfo("deprecated", null, "\"Use new/1\"", false, false, 0, null);

        Graph graph = Graph.of(builder.build(attribute, context).triples());
        Iri iri = Iri.of(BASE + "MyApp/attribute/deprecated/0");

        assertThat(graph.contains(iri, Rdf.TYPE, Structure.DEPRECATED_ATTRIBUTE)).isTrue();
        assertThat(graph.contains(iri, Structure.DEPRECATION_MESSAGE, Literal.string("\"Use new/1\""))).isTrue();
    }

    @Test
    void build_since_recordsVersion() {
        AttributeInfo attribute = new AttributeInfo("since", AttributeKind.SINCE, "\"1.2.0\"", false, false, 0, null);

        Graph graph = Graph.of(builder.build(attribute, context).triples());

        assertThat(graph.contains(Iri.of(BASE + "MyApp/attribute/since/0"), Structure.SINCE_VERSION,
            Literal.string("\"1.2.0\""))).isTrue();
    }

    @Test
    void build_docFalseAndAccumulating_areFlagged() {
        AttributeInfo docFalse = new AttributeInfo("moduledoc", null, "false", true, false, 0, null);
        AttributeInfo accumulating = new AttributeInfo("hooks", null, ":a", false, true, 1, null);

        Graph docGraph = Graph.of(builder.build(docFalse, context).triples());
        Graph hookGraph = Graph.of(builder.build(accumulating, context).triples());

        Iri moduledoc = Iri.of(BASE + "MyApp/attribute/moduledoc/0");
        assertThat(docGraph.contains(moduledoc, Rdf.TYPE, Structure.MODULEDOC_ATTRIBUTE)).isTrue();
        assertThat(docGraph.contains(moduledoc, Structure.IS_DOC_FALSE, Literal.bool(true))).isTrue();
        assertThat(hookGraph.contains(Iri.of(BASE + "MyApp/attribute/hooks/1"), Structure.IS_ACCUMULATING,
            Literal.bool(true))).isTrue();
    }

    @Test
    void build_withFile_addsSourceLocation() {
        AttributeInfo attribute = new AttributeInfo("doc", null, "\"Docs.\"", false, false, 0, SourceLocation.line(4));

        BuildResult result = builder.build(attribute, context.withFilePath("lib/my_app.ex"));

        assertThat(Graph.of(result.triples()).objects(result.iri(), Core.HAS_SOURCE_LOCATION)).hasSize(1);
    }

    @Test
    void classOf_everyKind_hasAClass() {
        for (AttributeKind kind : AttributeKind.values()) {
            assertThat(AttributeBuilder.classOf(kind)).as(kind.name()).isNotNull();
        }
        assertThat(AttributeBuilder.classOf(AttributeKind.BEHAVIOUR)).isEqualTo(Structure.BEHAVIOUR_DECLARATION);
    }
}
