package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.directive.Directive;
import com.codeontology.core.directive.DirectiveExtractor;
import com.codeontology.core.model.AgentInfo;
import com.codeontology.core.model.ChildSpecInfo;
import com.codeontology.core.model.ChildType;
import com.codeontology.core.model.DetectionMethod;
import com.codeontology.core.model.FunctionInfo;
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

import java.util.Arrays;
import java.util.List;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link OtpExtractor}.
 */
class OtpExtractorTest {

    private final OtpExtractor extractor = new OtpExtractor();
    private final DirectiveExtractor directives = new DirectiveExtractor();

    private ExtractionScope scope(String module, SyntaxNode... directiveNodes) {
        List<Directive> found = Arrays.stream(directiveNodes)
            .map(node -> directives.extract(node).orElseThrow())
            .toList();
        return ExtractionScope.of(module, found);
    }

    // ==================== GenServer ====================

    @Test
    void genServer_useDirective_detectsCallbacksAndOptions() {
        ExtractionScope scope = scope("MyApp.Cache",
            node(NodeTag.USE, moduleName("GenServer"), kw("restart", atom("transient"))));
        List<SyntaxNode> statements = List.of(
            def("init", List.of(var("state")), node(NodeTag.TUPLE, atom("ok"), var("state"))),
            def("handle_call", List.of(atom("get"), var("from"), var("s")), var("s")),
            def("handle_call", List.of(atom("put"), var("from"), var("s")), var("s")),
            def("handle_cast", List.of(var("msg"), var("s")), var("s")),
            def("start_link", List.of(var("opts")), var("opts")));
        List<FunctionInfo> functions = new FunctionExtractor().extract(statements, scope);

        GenServerInfo info = extractor.genServer(statements, scope, functions, null).orElseThrow();

        assertThat(info.detection()).isEqualTo(DetectionMethod.USE);
        assertThat(info.useOptions()).containsExactly("restart: :transient");
        assertThat(info.callbacks()).extracting(GenServerCallbackInfo::type, GenServerCallbackInfo::clauseCount)
            .containsExactly(
                tuple(GenServerCallbackType.INIT, 1),
                tuple(GenServerCallbackType.HANDLE_CALL, 2),
                tuple(GenServerCallbackType.HANDLE_CAST, 1));
    }

    @Test
    void genServer_behaviourAttribute_detectsByBehaviour() {
        ExtractionScope scope = scope("MyApp.Raw");
        List<SyntaxNode> statements = List.of(attribute("behaviour", moduleName("GenServer")));

        GenServerInfo info = extractor.genServer(statements, scope, List.of(), null).orElseThrow();

        assertThat(info.detection()).isEqualTo(DetectionMethod.BEHAVIOUR);
        assertThat(info.callbacks()).isEmpty();
    }

    @Test
    void genServer_plainModule_isEmpty() {
        assertThat(extractor.genServer(List.of(), scope("MyApp.Plain"), List.of(), null)).isEmpty();
    }

    @Test
    void callbackType_legacyFormatStatus_isRecognized() {
        assertThat(GenServerCallbackType.of("format_status", 2)).contains(GenServerCallbackType.FORMAT_STATUS);
        assertThat(GenServerCallbackType.of("handle_call", 2)).isEmpty();
    }

    // ==================== Supervisor ====================

    @Test
    void supervisor_initWithChildrenBinding_extractsStrategyAndChildren() {
        ExtractionScope scope = scope("MyApp.Sup",
            node(NodeTag.USE, moduleName("Supervisor")), alias("MyApp.Workers.Cache"));
        SyntaxNode children = node(NodeTag.MATCH, var("children"), node(NodeTag.LIST,
            moduleName("Cache"),
            node(NodeTag.TUPLE, moduleName("MyApp.Repo"), node(NodeTag.LIST)),
            node(NodeTag.MAP,
                kw("id", atom("poller")),
                kw("start", node(NodeTag.TUPLE, moduleName("MyApp.Poller"), atom("start"), node(NodeTag.LIST))),
                kw("restart", atom("temporary")),
                kw("type", atom("supervisor")))));
        SyntaxNode init = remoteCall("Supervisor", "init", var("children"),
            kw("strategy", atom("one_for_all")), kw("max_restarts", integer(10)));
        List<SyntaxNode> statements = List.of(def("init", List.of(var("_arg")), block(children, init)));

        SupervisorInfo info = extractor.supervisor(statements, scope, null).orElseThrow();

        assertThat(info.kind()).isEqualTo(SupervisorKind.SUPERVISOR);
        assertThat(info.strategy()).isEqualTo(SupervisorStrategy.ONE_FOR_ALL);
        assertThat(info.effectiveMaxRestarts()).isEqualTo(10);
        assertThat(info.effectiveMaxSeconds()).isEqualTo(SupervisorInfo.DEFAULT_MAX_SECONDS);
        assertThat(info.children()).extracting(ChildSpecInfo::id, ChildSpecInfo::startModule,
                ChildSpecInfo::startFunction, ChildSpecInfo::restart, ChildSpecInfo::type)
            .containsExactly(
                tuple("MyApp.Workers.Cache", "MyApp.Workers.Cache", "start_link", null, ChildType.WORKER),
                tuple("MyApp.Repo", "MyApp.Repo", "start_link", null, ChildType.WORKER),
                tuple("poller", "MyApp.Poller", "start", RestartType.TEMPORARY, ChildType.SUPERVISOR));
    }

    @Test
    void supervisor_dynamicSupervisor_hasNoStaticChildren() {
        ExtractionScope scope = scope("MyApp.Dyn", node(NodeTag.USE, moduleName("DynamicSupervisor")));
        List<SyntaxNode> statements = List.of(def("init", List.of(var("_")),
            remoteCall("DynamicSupervisor", "init", kw("strategy", atom("one_for_one")))));

        SupervisorInfo info = extractor.supervisor(statements, scope, null).orElseThrow();

        assertThat(info.kind()).isEqualTo(SupervisorKind.DYNAMIC);
        assertThat(info.strategy()).isEqualTo(SupervisorStrategy.ONE_FOR_ONE);
        assertThat(info.children()).isEmpty();
    }

    @Test
    void supervisor_withoutInit_keepsDefaults() {
        SupervisorInfo info = extractor.supervisor(List.of(), scope("S", node(NodeTag.USE, moduleName("Supervisor"))),
            null).orElseThrow();

        assertThat(info.strategy()).isNull();
        assertThat(info.effectiveMaxRestarts()).isEqualTo(SupervisorInfo.DEFAULT_MAX_RESTARTS);
    }

    // ==================== Agent and Task ====================

    @Test
    void agent_remoteCalls_detectedByFunctionCall() {
        List<SyntaxNode> statements = List.of(
            def("start", List.of(), remoteCall("Agent", "start_link", var("fun"), kw("name", var("__MODULE__")))),
            def("get", List.of(), remoteCall("Agent", "get", var("__MODULE__"), var("fun"))));

        AgentInfo info = extractor.agent(statements, scope("MyApp.Counter"), null).orElseThrow();

        assertThat(info.detection()).isEqualTo(DetectionMethod.FUNCTION_CALL);
        assertThat(info.functionsUsed()).containsExactly("start_link/2", "get/2");
    }

    @Test
    void task_supervisedCalls_reportTaskSupervisorKind() {
        List<SyntaxNode> statements = List.of(
            def("run", List.of(), block(
                remoteCall("Task", "async", var("fun")),
                remoteCall("Task.Supervisor", "start_child", var("sup"), var("fun")))));

        TaskInfo info = extractor.task(statements, scope("MyApp.Jobs"), null).orElseThrow();

        assertThat(info.kind()).isEqualTo(TaskKind.TASK_SUPERVISOR);
        assertThat(info.functionsUsed()).containsExactly("async/1", "start_child/2");
    }

    @Test
    void task_useTask_detectedByUse() {
        TaskInfo info = extractor.task(List.of(), scope("MyApp.OneOff", node(NodeTag.USE, moduleName("Task"))), null)
            .orElseThrow();

        assertThat(info.detection()).isEqualTo(DetectionMethod.USE);
        assertThat(info.kind()).isEqualTo(TaskKind.TASK);
    }

    @Test
    void agentAndTask_absent_areEmpty() {
        ExtractionScope scope = scope("MyApp.Plain");

        assertThat(extractor.agent(List.of(), scope, null)).isEmpty();
        assertThat(extractor.task(List.of(), scope, null)).isEmpty();
    }
}
