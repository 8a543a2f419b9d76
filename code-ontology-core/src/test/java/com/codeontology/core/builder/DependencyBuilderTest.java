package com.codeontology.core.builder;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.directive.Directive;
import com.codeontology.core.directive.DirectiveExtractor;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.ModuleInfo;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DependencyBuilder}.
 */
class DependencyBuilderTest {

    private static final String BASE = "https://example.org/code#";

    private final DependencyBuilder builder = new DependencyBuilder();

    private static ModuleInfo moduleWith(SyntaxNode... directiveNodes) {
        DirectiveExtractor extractor = new DirectiveExtractor();
        List<Directive> directives = Arrays.stream(directiveNodes)
            .map(node -> extractor.extract(node).orElseThrow())
            .toList();
        return new ModuleInfo("MyApp.Web", null, false, null, List.of(), directives, List.of(), List.of(),
            List.of(), null);
    }

    @Test
    void build_directivesOfEachKind_areIndexedPerKind() {
        ModuleInfo module = moduleWith(
            alias("MyApp.Repo"),
            aliasAs("MyApp.Accounts", "Acc"),
            node(NodeTag.IMPORT, moduleName("Ecto.Query")),
            node(NodeTag.REQUIRE, moduleName("Logger")));

        BuildResult result = builder.build(module, BuildContext.of(BASE));
        Graph graph = Graph.of(result.triples());
        Iri web = Iri.of(BASE + "MyApp.Web");

        assertThat(result.iri()).isEqualTo(web);
        assertThat(graph.objects(web, Structure.HAS_ALIAS))
            .containsExactly(web.resolve("/alias/0"), web.resolve("/alias/1"));
        assertThat(graph.contains(web.resolve("/alias/1"), Structure.ALIAS_NAME, Literal.string("Acc"))).isTrue();
        assertThat(graph.contains(web.resolve("/alias/1"), Structure.ALIASED_MODULE,
            Iri.of(BASE + "MyApp.Accounts"))).isTrue();
        assertThat(graph.contains(web.resolve("/import/0"), Rdf.TYPE, Structure.MODULE_IMPORT)).isTrue();
        assertThat(graph.contains(web.resolve("/import/0"), Structure.IMPORTED_MODULE,
            Iri.of(BASE + "Ecto.Query"))).isTrue();
        assertThat(graph.contains(web.resolve("/require/0"), Structure.REQUIRED_MODULE,
            Iri.of(BASE + "Logger"))).isTrue();
        assertThat(graph.contains(web.resolve("/alias/0"), Structure.DIRECTIVE_SCOPE, Literal.string("module")))
            .isTrue();
    }

    @Test
    void build_importFilters_areRendered() {
        ModuleInfo module = moduleWith(node(NodeTag.IMPORT, moduleName("Enum"),
            kw("only", node(NodeTag.LIST, kw("map", integer(2))))));

        Graph graph = Graph.of(builder.build(module, BuildContext.of(BASE)).triples());
        Iri imported = Iri.of(BASE + "MyApp.Web/import/0");

        assertThat(graph.contains(imported, Structure.IMPORT_ONLY, Literal.string("[map: 2]"))).isTrue();
        assertThat(graph.objects(imported, Structure.IMPORT_EXCEPT)).isEmpty();
    }

    @Test
    void build_useOptions_areRecorded() {
        ModuleInfo module = moduleWith(node(NodeTag.USE, moduleName("GenServer"), kw("restart", atom("transient"))));

        Graph graph = Graph.of(builder.build(module, BuildContext.of(BASE)).triples());
        Iri used = Iri.of(BASE + "MyApp.Web/use/0");

        assertThat(graph.contains(used, Rdf.TYPE, Structure.MODULE_USE)).isTrue();
        assertThat(graph.contains(used, Structure.USED_MODULE, Iri.of(BASE + "GenServer"))).isTrue();
        assertThat(graph.contains(used, Structure.USE_OPTION, Literal.string("restart: :transient"))).isTrue();
    }

    @Test
    void build_withKnownModules_flagsExternalTargets() {
        ModuleInfo module = moduleWith(alias("MyApp.Repo"), alias("Ecto.Changeset"));
        BuildContext context = BuildContext.of(BASE).withKnownModules(Set.of("MyApp.Repo", "MyApp.Web"));

        Graph graph = Graph.of(builder.build(module, context).triples());

        assertThat(graph.contains(Iri.of(BASE + "MyApp.Web/alias/0"), Structure.IS_EXTERNAL_MODULE,
            Literal.bool(false))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "MyApp.Web/alias/1"), Structure.IS_EXTERNAL_MODULE,
            Literal.bool(true))).isTrue();
    }

    @Test
    void build_withoutKnownModules_omitsExternalFlag() {
        Graph graph = Graph.of(builder.build(moduleWith(alias("MyApp.Repo")), BuildContext.of(BASE)).triples());

        assertThat(graph.objects(Iri.of(BASE + "MyApp.Web/alias/0"), Structure.IS_EXTERNAL_MODULE)).isEmpty();
    }

    @Test
    void build_noDirectives_emitsNothing() {
        assertThat(builder.build(moduleWith(), BuildContext.of(BASE)).triples()).isEmpty();
    }
}
