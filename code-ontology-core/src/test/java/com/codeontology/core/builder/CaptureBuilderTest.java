package com.codeontology.core.builder;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.CaptureInfo;
import com.codeontology.core.model.CaptureKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CaptureBuilder}.
 */
class CaptureBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final CaptureBuilder builder = new CaptureBuilder();
    private final BuildContext context = BuildContext.of(BASE).withModule("MyApp");

    private static CaptureInfo named(CaptureKind kind, String module, String function, int arity) {
        return new CaptureInfo(0, kind, module, function, arity, List.of(), "run", 1, null);
    }

    @Test
    void build_localCapture_refersToFunctionInCurrentModule() {
        BuildResult result = builder.build(named(CaptureKind.NAMED_LOCAL, null, "format", 1), context);
        Graph graph = Graph.of(result.triples());
        Iri capture = Iri.of(BASE + "MyApp/&/0");

        assertThat(result.iri()).isEqualTo(capture);
        assertThat(graph.contains(capture, Rdf.TYPE, Structure.CAPTURED_FUNCTION)).isTrue();
        assertThat(graph.contains(capture, Structure.ARITY, Literal.nonNegative(1))).isTrue();
        assertThat(graph.contains(capture, Core.REFERS_TO_FUNCTION, Iri.of(BASE + "MyApp/format/1"))).isTrue();
        assertThat(graph.objects(capture, Core.REFERS_TO_MODULE)).isEmpty();
        assertThat(graph.contains(Iri.of(BASE + "MyApp/run/1"), Structure.CONTAINS_ANONYMOUS_FUNCTION, capture))
            .isTrue();
    }

    @Test
    void build_remoteCapture_refersToModuleAndFunction() {
        Graph graph = Graph.of(builder.build(named(CaptureKind.NAMED_REMOTE, "String", "upcase", 1), context)
            .triples());
        Iri capture = Iri.of(BASE + "MyApp/&/0");

        assertThat(graph.contains(capture, Core.REFERS_TO_MODULE, Iri.of(BASE + "String"))).isTrue();
        assertThat(graph.contains(capture, Core.REFERS_TO_FUNCTION, Iri.of(BASE + "String/upcase/1"))).isTrue();
    }

    @Test
    void build_remoteCaptureWithRuntimeReceiver_hasNoReferences() {
        Graph graph = Graph.of(builder.build(named(CaptureKind.NAMED_REMOTE, null, "run", 0), context).triples());
        Iri capture = Iri.of(BASE + "MyApp/&/0");

        assertThat(graph.contains(capture, Rdf.TYPE, Structure.CAPTURED_FUNCTION)).isTrue();
        assertThat(graph.objects(capture, Core.REFERS_TO_FUNCTION)).isEmpty();
        assertThat(graph.objects(capture, Core.REFERS_TO_MODULE)).isEmpty();
    }

    @Test
    void build_shorthand_isPartialApplicationContainedByModule() {
        CaptureInfo shorthand = new CaptureInfo(2, CaptureKind.SHORTHAND, null, null, 2, List.of(1, 2), null, null,
            SourceLocation.of(4, 4));

        Graph graph = Graph.of(builder.build(shorthand, context.withFilePath("lib/my_app.ex")).triples());
        Iri capture = Iri.of(BASE + "MyApp/&/2");

        assertThat(graph.contains(capture, Rdf.TYPE, Structure.PARTIAL_APPLICATION)).isTrue();
        assertThat(graph.contains(capture, Structure.ARITY, Literal.nonNegative(2))).isTrue();
        assertThat(graph.objects(capture, Core.REFERS_TO_FUNCTION)).isEmpty();
        assertThat(graph.contains(Iri.of(BASE + "MyApp"), Structure.CONTAINS_ANONYMOUS_FUNCTION, capture)).isTrue();
        assertThat(graph.objects(capture, Core.HAS_SOURCE_LOCATION)).hasSize(1);
    }

    @Test
    void build_withoutModule_throwsException() {
        CaptureInfo info = named(CaptureKind.NAMED_LOCAL, null, "format", 1);

        assertThatThrownBy(() -> builder.build(info, BuildContext.of(BASE)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("CaptureBuilder");
    }
}
