package com.codeontology.core.builder;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.directive.DirectiveExtractor;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.ModuleInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ModuleBuilder}.
 */
class ModuleBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final ModuleBuilder builder = new ModuleBuilder();

    @Test
    void build_topLevelModule_emitsClassNameAndMembers() {
        ModuleInfo module = new ModuleInfo("MyApp.Users", "Users.", false, null, List.of("MyApp.Users.Query"),
            List.of(new DirectiveExtractor().extract(alias("MyApp.Repo")).orElseThrow()),
            List.of(new FunctionSignature("get", 1)),
            List.of(new FunctionSignature("query", 1)),
            List.of(new FunctionSignature("t", 0)),
            null);

        BuildResult result = builder.build(module, BuildContext.of(BASE));
        Graph graph = Graph.of(result.triples());
        Iri moduleIri = Iri.of(BASE + "MyApp.Users");

        assertThat(result.iri()).isEqualTo(moduleIri);
        assertThat(graph.contains(moduleIri, Rdf.TYPE, Structure.MODULE)).isTrue();
        assertThat(graph.contains(moduleIri, Structure.MODULE_NAME, Literal.string("MyApp.Users"))).isTrue();
        assertThat(graph.contains(moduleIri, Structure.DOCSTRING, Literal.string("Users."))).isTrue();
        assertThat(graph.contains(moduleIri, Structure.ALIASES_MODULE, Iri.of(BASE + "MyApp.Repo"))).isTrue();
        assertThat(graph.contains(moduleIri, Structure.CONTAINS_FUNCTION, Iri.of(BASE + "MyApp.Users/get/1"))).isTrue();
        assertThat(graph.contains(moduleIri, Structure.CONTAINS_MACRO, Iri.of(BASE + "MyApp.Users/query/1"))).isTrue();
        assertThat(graph.contains(moduleIri, Structure.CONTAINS_TYPE,
            IriGenerator.forType(BASE, "MyApp.Users", "t", 0))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "MyApp.Users.Query"), Structure.PARENT_MODULE, moduleIri)).isTrue();
        assertThat(graph.objects(moduleIri, Structure.IS_DOC_FALSE)).isEmpty();
    }

    @Test
    void build_nestedModule_linksParentBothWays() {
        ModuleInfo module = new ModuleInfo("Outer.Inner", null, true, "Outer", List.of(), List.of(), List.of(),
            List.of(), List.of(), null);

        Graph graph = Graph.of(builder.build(module, BuildContext.of(BASE)).triples());
        Iri inner = Iri.of(BASE + "Outer.Inner");
        Iri outer = Iri.of(BASE + "Outer");

        assertThat(graph.contains(inner, Rdf.TYPE, Structure.NESTED_MODULE)).isTrue();
        assertThat(graph.contains(inner, Structure.PARENT_MODULE, outer)).isTrue();
        assertThat(graph.contains(outer, Structure.HAS_NESTED_MODULE, inner)).isTrue();
        assertThat(graph.contains(inner, Structure.IS_DOC_FALSE, Literal.bool(true))).isTrue();
        assertThat(graph.objects(inner, Structure.DOCSTRING)).isEmpty();
    }

    @Test
    void build_withSourceFile_addsLocation() {
        ModuleInfo module = new ModuleInfo("A", null, false, null, List.of(), List.of(), List.of(), List.of(),
            List.of(), SourceLocation.of(1, 20));
        BuildContext context = BuildContext.of(BASE).withFilePath("lib/a.ex");

        Graph graph = Graph.of(builder.build(module, context).triples());
        Iri file = IriGenerator.forSourceFile(BASE, "lib/a.ex");
        Iri location = IriGenerator.forSourceLocation(file, 1, 20);

        assertThat(graph.contains(Iri.of(BASE + "A"), Core.HAS_SOURCE_LOCATION, location)).isTrue();
        assertThat(graph.contains(location, Core.START_LINE, Literal.positive(1))).isTrue();
        assertThat(graph.contains(location, Core.END_LINE, Literal.positive(20))).isTrue();
        assertThat(graph.contains(location, Core.IN_SOURCE_FILE, file)).isTrue();
    }

    @Test
    void build_withoutSourceFile_omitsLocation() {
        ModuleInfo module = new ModuleInfo("A", null, false, null, List.of(), List.of(), List.of(), List.of(),
            List.of(), SourceLocation.of(1, 20));

        Graph graph = Graph.of(builder.build(module, BuildContext.of(BASE)).triples());

        assertThat(graph.objects(Iri.of(BASE + "A"), Core.HAS_SOURCE_LOCATION)).isEmpty();
    }
}
