package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.BehaviourInfo;
import com.codeontology.core.model.CallbackInfo;
import com.codeontology.core.model.FunctionSignature;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link BehaviourBuilder}.
 */
class BehaviourBuilderTest {

    private static final String BASE = "https://example.org/code#";

    @Test
    void build_behaviourDefinition_emitsCallbacks() {
        BehaviourInfo behaviour = new BehaviourInfo("MyApp.Plugin", List.of(
            new CallbackInfo("init", 1, false, false, "Initializes.", null),
            new CallbackInfo("describe", 0, false, true, null, null),
            new CallbackInfo("wrap", 1, true, false, null, null)), List.of(), List.of(), null);

        BuildResult result = new BehaviourBuilder().build(behaviour, BuildContext.of(BASE));
        Graph graph = Graph.of(result.triples());
        Iri plugin = Iri.of(BASE + "MyApp.Plugin");
        Iri init = plugin.resolve("/callback/init/1");

        assertThat(result.iri()).isEqualTo(plugin);
        assertThat(graph.contains(plugin, Rdf.TYPE, Structure.BEHAVIOUR)).isTrue();
        assertThat(graph.objects(plugin, Structure.DEFINES_CALLBACK)).containsExactly(
            init, plugin.resolve("/callback/describe/0"), plugin.resolve("/callback/wrap/1"));
        assertThat(graph.contains(init, Rdf.TYPE, Structure.CALLBACK)).isTrue();
        assertThat(graph.contains(init, Structure.DOCSTRING, Literal.string("Initializes."))).isTrue();
        assertThat(graph.objects(plugin.resolve("/callback/describe/0"), Rdf.TYPE))
            .containsExactly(Structure.CALLBACK, Structure.OPTIONAL_CALLBACK);
        assertThat(graph.contains(plugin.resolve("/callback/wrap/1"), Rdf.TYPE, Structure.MACRO_CALLBACK)).isTrue();
    }

    @Test
    void build_genServerImplementation_linksMatchingCallbacks() {
        BehaviourInfo behaviour = new BehaviourInfo("MyApp.Cache", List.of(), List.of("GenServer"),
            List.of(new FunctionSignature("init", 1), new FunctionSignature("handle_call", 3),
                new FunctionSignature("get", 1)), null);

        Graph graph = Graph.of(new BehaviourBuilder().build(behaviour, BuildContext.of(BASE)).triples());
        Iri genServer = Iri.of(BASE + "GenServer");

        assertThat(graph.contains(Iri.of(BASE + "MyApp.Cache"), Structure.IMPLEMENTS_BEHAVIOUR, genServer)).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "MyApp.Cache/init/1"), Structure.IMPLEMENTS_CALLBACK,
            genServer.resolve("/callback/init/1"))).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "MyApp.Cache/handle_call/3"), Structure.IMPLEMENTS_CALLBACK,
            genServer.resolve("/callback/handle_call/3"))).isTrue();
        assertThat(graph.objects(Iri.of(BASE + "MyApp.Cache/get/1"), Structure.IMPLEMENTS_CALLBACK)).isEmpty();
        assertThat(graph.objects(Iri.of(BASE + "MyApp.Cache"), Rdf.TYPE)).isEmpty();
    }

    @Test
    void build_projectBehaviour_usesRegisteredCallbacks() {
        BehaviourBuilder builder = new BehaviourBuilder(
            Map.of("MyApp.Plugin", Set.of(new FunctionSignature("init", 1))));
        BehaviourInfo behaviour = new BehaviourInfo("MyApp.Auth", List.of(), List.of("MyApp.Plugin"),
            List.of(new FunctionSignature("init", 1)), null);

        Graph graph = Graph.of(builder.build(behaviour, BuildContext.of(BASE)).triples());

        assertThat(graph.contains(Iri.of(BASE + "MyApp.Auth/init/1"), Structure.IMPLEMENTS_CALLBACK,
            Iri.of(BASE + "MyApp.Plugin/callback/init/1"))).isTrue();
    }

    @Test
    void build_unknownBehaviour_linksBehaviourOnly() {
        BehaviourInfo behaviour = new BehaviourInfo("MyApp.Auth", List.of(), List.of("Ext.Plugin"),
            List.of(new FunctionSignature("init", 1)), null);

        Graph graph = Graph.of(new BehaviourBuilder().build(behaviour, BuildContext.of(BASE)).triples());

        assertThat(graph.size()).isEqualTo(1);
        assertThat(graph.contains(Iri.of(BASE + "MyApp.Auth"), Structure.IMPLEMENTS_BEHAVIOUR,
            Iri.of(BASE + "Ext.Plugin"))).isTrue();
    }
}
