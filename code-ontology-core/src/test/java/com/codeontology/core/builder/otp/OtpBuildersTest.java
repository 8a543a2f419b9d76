package com.codeontology.core.builder.otp;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.builder.BuildResult;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Otp;
import com.codeontology.core.graph.vocab.Rdf;
import com.codeontology.core.model.AgentInfo;
import com.codeontology.core.model.ChildSpecInfo;
import com.codeontology.core.model.ChildType;
import com.codeontology.core.model.DetectionMethod;
import com.codeontology.core.model.GenServerCallbackInfo;
import com.codeontology.core.model.GenServerCallbackType;
import com.codeontology.core.model.GenServerInfo;
import com.codeontology.core.model.RestartType;
import com.codeontology.core.model.SupervisorInfo;
import com.codeontology.core.model.SupervisorKind;
import com.codeontology.core.model.SupervisorStrategy;
import com.codeontology.core.model.TaskInfo;
import com.codeontology.core.model.TaskKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GenServerBuilder}, {@link SupervisorBuilder}, {@link AgentBuilder} and
 * {@link TaskBuilder}.
 */
class OtpBuildersTest {

    private static final String BASE = "https://example.org/code#";

    private final BuildContext context = BuildContext.of(BASE);

    // ==================== GenServer ====================

    @Test
    void genServer_callbacks_areTypedOnImplementingFunctions() {
        GenServerInfo genServer = new GenServerInfo("MyApp.Cache", DetectionMethod.USE, List.of(), List.of(
            new GenServerCallbackInfo(GenServerCallbackType.INIT, 1, 1, null),
            new GenServerCallbackInfo(GenServerCallbackType.HANDLE_CALL, 3, 2, null)), null);

        BuildResult result = new GenServerBuilder().build(genServer, context);
        Graph graph = Graph.of(result.triples());
        Iri cache = Iri.of(BASE + "MyApp.Cache");
        Iri handleCall = Iri.of(BASE + "MyApp.Cache/handle_call/3");

        assertThat(result.iri()).isEqualTo(cache);
        assertThat(graph.contains(cache, Rdf.TYPE, Otp.GEN_SERVER_IMPLEMENTATION)).isTrue();
        assertThat(graph.contains(cache, Otp.IMPLEMENTS_OTP_BEHAVIOUR, Otp.GEN_SERVER)).isTrue();
        assertThat(graph.objects(cache, Otp.HAS_GEN_SERVER_CALLBACK))
            .containsExactly(Iri.of(BASE + "MyApp.Cache/init/1"), handleCall);
        assertThat(graph.objects(handleCall, Rdf.TYPE))
            .containsExactly(Otp.GEN_SERVER_CALLBACK, Otp.HANDLE_CALL_CALLBACK);
    }

    @Test
    void genServer_legacyFormatStatus_keepsImplementedArity() {
        GenServerInfo genServer = new GenServerInfo("S", DetectionMethod.BEHAVIOUR, List.of(),
            List.of(new GenServerCallbackInfo(GenServerCallbackType.FORMAT_STATUS, 2, 1, null)), null);

        Graph graph = Graph.of(new GenServerBuilder().build(genServer, context).triples());

        assertThat(graph.contains(Iri.of(BASE + "S/format_status/2"), Rdf.TYPE, Otp.FORMAT_STATUS_CALLBACK))
            .isTrue();
    }

    // ==================== Supervisor ====================

    @Test
    void supervisor_childSpecs_areIndexedWithDefaults() {
        SupervisorInfo supervisor = new SupervisorInfo("MyApp.Sup", SupervisorKind.SUPERVISOR, DetectionMethod.USE,
            SupervisorStrategy.ONE_FOR_ALL, 10, null, List.of(
                new ChildSpecInfo("MyApp.Cache", "MyApp.Cache", null, null, null, null),
                new ChildSpecInfo("poller", "MyApp.Poller", "start", RestartType.TEMPORARY, ChildType.SUPERVISOR,
                    null)), null);

        Graph graph = Graph.of(new SupervisorBuilder().build(supervisor, context).triples());
        Iri sup = Iri.of(BASE + "MyApp.Sup");
        Iri cache = sup.resolve("/child/MyApp.Cache/0");
        Iri poller = sup.resolve("/child/poller/1");

        assertThat(graph.contains(sup, Rdf.TYPE, Otp.SUPERVISOR)).isTrue();
        assertThat(graph.contains(sup, Otp.HAS_STRATEGY, Otp.ONE_FOR_ALL)).isTrue();
        assertThat(graph.contains(sup, Otp.MAX_RESTARTS, Literal.nonNegative(10))).isTrue();
        assertThat(graph.contains(sup, Otp.MAX_SECONDS, Literal.nonNegative(5))).isTrue();
        assertThat(graph.objects(sup, Otp.HAS_CHILD_SPEC)).containsExactly(cache, poller);
        assertThat(graph.contains(cache, Otp.START_FUNCTION, Literal.string("start_link"))).isTrue();
        assertThat(graph.contains(cache, Otp.HAS_RESTART_STRATEGY, Otp.PERMANENT)).isTrue();
        assertThat(graph.contains(cache, Otp.HAS_CHILD_TYPE, Otp.WORKER_TYPE)).isTrue();
        assertThat(graph.contains(poller, Otp.HAS_RESTART_STRATEGY, Otp.TEMPORARY)).isTrue();
        assertThat(graph.contains(poller, Otp.HAS_CHILD_TYPE, Otp.SUPERVISOR_TYPE)).isTrue();
        assertThat(graph.contains(sup, Otp.SUPERVISES, Iri.of(BASE + "MyApp.Poller"))).isTrue();
    }

    @Test
    void supervisor_dynamicWithoutStrategy_defaultsToOneForOne() {
        SupervisorInfo supervisor = new SupervisorInfo("Dyn", SupervisorKind.DYNAMIC, DetectionMethod.USE,
            null, null, null, List.of(), null);

        Graph graph = Graph.of(new SupervisorBuilder().build(supervisor, context).triples());
        Iri dyn = Iri.of(BASE + "Dyn");

        assertThat(graph.contains(dyn, Rdf.TYPE, Otp.DYNAMIC_SUPERVISOR)).isTrue();
        assertThat(graph.contains(dyn, Otp.HAS_STRATEGY, Otp.ONE_FOR_ONE)).isTrue();
        assertThat(graph.contains(dyn, Otp.MAX_RESTARTS, Literal.nonNegative(3))).isTrue();
    }

    @Test
    void supervisor_plainWithoutStrategy_omitsStrategy() {
        SupervisorInfo supervisor = new SupervisorInfo("Sup", SupervisorKind.SUPERVISOR, DetectionMethod.BEHAVIOUR,
            null, null, null, List.of(), null);

        Graph graph = Graph.of(new SupervisorBuilder().build(supervisor, context).triples());

        assertThat(graph.objects(Iri.of(BASE + "Sup"), Otp.HAS_STRATEGY)).isEmpty();
    }

    // ==================== Agent and Task ====================

    @Test
    void agent_recordsFunctionsUsed() {
        AgentInfo agent = new AgentInfo("Counter", DetectionMethod.FUNCTION_CALL, List.of("start_link/2", "get/2"),
            SourceLocation.line(2));

        Graph graph = Graph.of(new AgentBuilder().build(agent, context.withFilePath("lib/counter.ex")).triples());
        Iri counter = Iri.of(BASE + "Counter");

        assertThat(graph.contains(counter, Rdf.TYPE, Otp.AGENT)).isTrue();
        assertThat(graph.objects(counter, Otp.USES_AGENT_FUNCTION))
            .containsExactly(Literal.string("start_link/2"), Literal.string("get/2"));
        assertThat(graph.objects(counter, Core.HAS_SOURCE_LOCATION)).hasSize(1);
    }

    @Test
    void task_supervisorKind_usesTaskSupervisorClass() {
        TaskInfo task = new TaskInfo("Jobs", TaskKind.TASK_SUPERVISOR, DetectionMethod.FUNCTION_CALL,
            List.of("async/1"), null);

        Graph graph = Graph.of(new TaskBuilder().build(task, context).triples());

        assertThat(graph.contains(Iri.of(BASE + "Jobs"), Rdf.TYPE, Otp.TASK_SUPERVISOR)).isTrue();
        assertThat(graph.contains(Iri.of(BASE + "Jobs"), Otp.USES_TASK_FUNCTION, Literal.string("async/1"))).isTrue();
    }
}
