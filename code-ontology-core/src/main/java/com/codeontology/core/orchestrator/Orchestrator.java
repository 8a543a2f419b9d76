package com.codeontology.core.orchestrator;

import com.codeontology.core.builder.AnonymousFunctionBuilder;
import com.codeontology.core.builder.AttributeBuilder;
import com.codeontology.core.builder.BehaviourBuilder;
import com.codeontology.core.builder.BuildResult;
import com.codeontology.core.builder.CallGraphBuilder;
import com.codeontology.core.builder.CaptureBuilder;
import com.codeontology.core.builder.ControlFlowBuilder;
import com.codeontology.core.builder.DependencyBuilder;
import com.codeontology.core.builder.EntityBuilder;
import com.codeontology.core.builder.FunctionBuilder;
import com.codeontology.core.builder.MacroInvocationBuilder;
import com.codeontology.core.builder.ModuleBuilder;
import com.codeontology.core.builder.ProtocolBuilder;
import com.codeontology.core.builder.QuoteBuilder;
import com.codeontology.core.builder.StructBuilder;
import com.codeontology.core.builder.TypeSystemBuilder;
import com.codeontology.core.builder.otp.AgentBuilder;
import com.codeontology.core.builder.otp.GenServerBuilder;
import com.codeontology.core.builder.otp.SupervisorBuilder;
import com.codeontology.core.builder.otp.TaskBuilder;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Triple;
import com.codeontology.core.model.CallbackInfo;
import com.codeontology.core.model.FunctionInfo;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.FunctionSpecInfo;
import com.codeontology.core.model.ModuleAnalysis;
import com.codeontology.core.model.ProtocolImplementationInfo;
import com.codeontology.core.model.TypeDefinitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Turns extracted modules into a knowledge graph.
 *
 * <p>Each run moves through {@link OrchestratorState}: the module phase builds the module entity
 * with its directives and attributes and aborts the run on failure; the entity phase runs one
 * {@link EntityTask} per enabled {@link BuilderKind}, concurrently on a bounded pool unless
 * disabled; the aggregate phase deduplicates everything into a {@link Graph}.
 *
 * <p>In parallel mode every entity task gets its own thread and the timeout is one deadline
 * counted from submission, so a run waits at most one timeout for its entity phase.
 *
 * <p>A failed or timed-out entity task contributes no triples. The failure is logged at WARN and
 * recorded in the {@link BuildReport}; the run continues.
 *
 * <p>The context counter is reset at the start of every module. Only the function task consumes
 * it, threading it through functions, clauses and expressions in order, so expression IRIs do
 * not depend on scheduling.
 *
 * <pre>{@code
 * GraphBuildResult result = new Orchestrator().build(analysis, BuildContext.of("https://example.org/code#"));
 * result.graph().toNTriples();
 * }</pre>
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final ModuleBuilder moduleBuilder = new ModuleBuilder();
    private final DependencyBuilder dependencyBuilder = new DependencyBuilder();
    private final AttributeBuilder attributeBuilder = new AttributeBuilder();
    private final Map<BuilderKind, EntityTask> overrides;

    public Orchestrator() {
        this(Map.of());
    }

    private Orchestrator(Map<BuilderKind, EntityTask> overrides) {
        this.overrides = overrides;
    }

    /**
     * Returns a copy that runs {@code task} for {@code kind} instead of the built-in builder.
     *
     * @param kind builder kind to replace
     * @param task replacement
     * @return new orchestrator
     */
    public Orchestrator withTask(BuilderKind kind, EntityTask task) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(task, "task must not be null");
        Map<BuilderKind, EntityTask> copy = new EnumMap<>(BuilderKind.class);
        copy.putAll(overrides);
        copy.put(kind, task);
        return new Orchestrator(Collections.unmodifiableMap(copy));
    }

    public GraphBuildResult build(ModuleAnalysis analysis, BuildContext context) {
        return build(analysis, context, OrchestratorOptions.defaults());
    }

    /**
     * Builds the graph of one module.
     *
     * @param analysis extracted module
     * @param context base context
     * @param options builder selection and scheduling
     * @return graph, module IRI and report
     * @throws IllegalArgumentException if the analysis has no module info
     */
    public GraphBuildResult build(ModuleAnalysis analysis, BuildContext context, OrchestratorOptions options) {
        return run(analysis, context, options, new BehaviourBuilder());
    }

    public GraphBuildResult buildAll(List<ModuleAnalysis> analyses, BuildContext context) {
        return buildAll(analyses, context, OrchestratorOptions.defaults());
    }

    /**
     * Builds several modules into one graph.
     *
     * <p>Callbacks declared by behaviours among the analyses are made known to every module, so a
     * module implementing a project behaviour links its callback implementations.
     *
     * @param analyses extracted modules
     * @param context base context
     * @param options builder selection and scheduling
     * @return merged graph, module IRIs in input order and merged report
     */
    public GraphBuildResult buildAll(List<ModuleAnalysis> analyses, BuildContext context, OrchestratorOptions options) {
        Objects.requireNonNull(analyses, "analyses must not be null");
        BehaviourBuilder behaviourBuilder = new BehaviourBuilder(declaredCallbacks(analyses));

        Graph graph = Graph.empty();
        List<Iri> modules = new ArrayList<>();
        BuildReport report = BuildReport.empty();
        for (ModuleAnalysis analysis : analyses) {
            GraphBuildResult result = run(analysis, context, options, behaviourBuilder);
            graph = graph.merge(result.graph());
            modules.addAll(result.modules());
            report = report.merge(result.report());
        }
        log.info("Built {} modules into {} triples ({} builder failures)",
            modules.size(), graph.size(), report.failures().size());
        return new GraphBuildResult(graph, modules, report);
    }

    // ==================== Run ====================

    private GraphBuildResult run(ModuleAnalysis analysis, BuildContext context, OrchestratorOptions options,
                                 BehaviourBuilder behaviourBuilder) {
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (analysis.module() == null) {
            throw new IllegalArgumentException("ModuleAnalysis has no module info");
        }

        List<OrchestratorState> states = new ArrayList<>();
        transition(states, OrchestratorState.START, analysis.moduleName());
        String moduleName = analysis.moduleName();
        BuildContext moduleContext = context.withCounterReset().withModule(moduleName);

        transition(states, OrchestratorState.MODULE_PHASE, moduleName);
        List<List<Triple>> parts = new ArrayList<>();
        BuildResult module = moduleBuilder.build(analysis.module(), moduleContext);
        parts.add(module.triples());
        parts.add(dependencyBuilder.build(analysis.module(), moduleContext).triples());
        analysis.attributes().forEach(attribute -> parts.add(attributeBuilder.build(attribute, moduleContext).triples()));

        transition(states, OrchestratorState.ENTITY_PHASE, moduleName);
        Map<BuilderKind, EntityTask> tasks = new EnumMap<>(BuilderKind.class);
        Map<BuilderKind, EntityTask> defaults = defaultTasks(behaviourBuilder);
        for (BuilderKind kind : options.enabledKinds()) {
            tasks.put(kind, overrides.getOrDefault(kind, defaults.get(kind)));
        }
        List<BuilderKind> completed = new ArrayList<>();
        List<BuildFailure> failures = new ArrayList<>();
        Map<BuilderKind, List<Triple>> contributions = options.parallel()
            ? runParallel(tasks, analysis, moduleContext, options, completed, failures)
            : runSequential(tasks, analysis, moduleContext, completed, failures);
        parts.addAll(contributions.values());

        transition(states, OrchestratorState.AGGREGATE, moduleName);
        Graph graph = Graph.concat(parts);

        transition(states, OrchestratorState.DONE, moduleName);
        log.debug("Module {}: {} triples from {} builders", moduleName, graph.size(), completed.size());
        return new GraphBuildResult(graph, List.of(module.iri()), new BuildReport(completed, failures, states));
    }

    private Map<BuilderKind, List<Triple>> runSequential(Map<BuilderKind, EntityTask> tasks, ModuleAnalysis analysis,
                                                         BuildContext context, List<BuilderKind> completed,
                                                         List<BuildFailure> failures) {
        Map<BuilderKind, List<Triple>> contributions = new LinkedHashMap<>();
        for (Map.Entry<BuilderKind, EntityTask> entry : tasks.entrySet()) {
            try {
                contributions.put(entry.getKey(), entry.getValue().build(analysis, context));
                completed.add(entry.getKey());
            } catch (Exception e) {
                fail(failures, analysis.moduleName(), entry.getKey(), describe(e), e);
            }
        }
        return contributions;
    }

    private Map<BuilderKind, List<Triple>> runParallel(Map<BuilderKind, EntityTask> tasks, ModuleAnalysis analysis,
                                                       BuildContext context, OrchestratorOptions options,
                                                       List<BuilderKind> completed, List<BuildFailure> failures) {
        Map<BuilderKind, List<Triple>> contributions = new LinkedHashMap<>();
        if (tasks.isEmpty()) {
            return contributions;
        }
        // One thread per task, at most one per builder kind: no task waits in a queue, so the
        // shared deadline is every task's own running time.
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        try {
            Map<BuilderKind, Future<List<Triple>>> futures = new EnumMap<>(BuilderKind.class);
            tasks.forEach((kind, task) -> futures.put(kind, executor.submit(() -> task.build(analysis, context))));

            long timeoutMillis = options.timeout().toMillis();
            long deadline = System.nanoTime() + options.timeout().toNanos();
            for (Map.Entry<BuilderKind, Future<List<Triple>>> entry : futures.entrySet()) {
                BuilderKind kind = entry.getKey();
                Future<List<Triple>> future = entry.getValue();
                try {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    contributions.put(kind, future.get(remaining, TimeUnit.NANOSECONDS));
                    completed.add(kind);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    fail(failures, analysis.moduleName(), kind, "timed out after " + timeoutMillis + " ms", null);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    fail(failures, analysis.moduleName(), kind, describe(cause), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(true);
                    fail(failures, analysis.moduleName(), kind, "interrupted", e);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return contributions;
    }

    private void fail(List<BuildFailure> failures, String module, BuilderKind kind, String reason, Throwable cause) {
        log.warn("Builder {} failed for module {}: {}", kind.id(), module, reason);
        if (cause != null && log.isDebugEnabled()) {
            log.debug("Builder {} failure detail", kind.id(), cause);
        }
        failures.add(new BuildFailure(module, kind, reason));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage() : e.getClass().getSimpleName();
    }

    private void transition(List<OrchestratorState> states, OrchestratorState next, String module) {
        states.add(next);
        log.trace("Module {} -> {}", module, next);
    }

    // ==================== Entity tasks ====================

    private Map<BuilderKind, EntityTask> defaultTasks(BehaviourBuilder behaviourBuilder) {
        FunctionBuilder functionBuilder = new FunctionBuilder();
        ProtocolBuilder protocolBuilder = new ProtocolBuilder();
        StructBuilder structBuilder = new StructBuilder();
        TypeSystemBuilder typeBuilder = new TypeSystemBuilder();

        Map<BuilderKind, EntityTask> tasks = new EnumMap<>(BuilderKind.class);
        tasks.put(BuilderKind.FUNCTIONS, (analysis, context) -> {
            List<Triple> triples = new ArrayList<>();
            BuildContext current = context;
            for (FunctionInfo function : analysis.functions()) {
                BuildResult built = functionBuilder.build(function, current);
                triples.addAll(built.triples());
                current = built.context();
            }
            return triples;
        });
        tasks.put(BuilderKind.PROTOCOLS, (analysis, context) -> {
            List<Triple> triples = new ArrayList<>();
            if (analysis.protocol() != null) {
                triples.addAll(protocolBuilder.build(analysis.protocol(), context).triples());
            }
            for (ProtocolImplementationInfo implementation : analysis.implementations()) {
                triples.addAll(protocolBuilder.buildImplementation(implementation, context).triples());
            }
            return triples;
        });
        tasks.put(BuilderKind.BEHAVIOURS, single(ModuleAnalysis::behaviour, behaviourBuilder));
        tasks.put(BuilderKind.STRUCTS, single(ModuleAnalysis::struct, structBuilder));
        tasks.put(BuilderKind.EXCEPTIONS, (analysis, context) -> analysis.exception() == null
            ? List.of()
            : structBuilder.buildException(analysis.exception(), context).triples());
        tasks.put(BuilderKind.TYPES, (analysis, context) -> {
            List<Triple> triples = new ArrayList<>();
            for (TypeDefinitionInfo type : analysis.types()) {
                triples.addAll(typeBuilder.build(type, context).triples());
            }
            for (FunctionSpecInfo spec : analysis.specs()) {
                triples.addAll(typeBuilder.buildSpec(spec, context).triples());
            }
            return triples;
        });
        tasks.put(BuilderKind.GENSERVERS, single(ModuleAnalysis::genServer, new GenServerBuilder()));
        tasks.put(BuilderKind.SUPERVISORS, single(ModuleAnalysis::supervisor, new SupervisorBuilder()));
        tasks.put(BuilderKind.AGENTS, single(ModuleAnalysis::agent, new AgentBuilder()));
        tasks.put(BuilderKind.TASKS, single(ModuleAnalysis::task, new TaskBuilder()));
        tasks.put(BuilderKind.CALLS, each(ModuleAnalysis::calls, new CallGraphBuilder()));
        tasks.put(BuilderKind.CONTROL_FLOW, each(ModuleAnalysis::controlFlows, new ControlFlowBuilder()));
        EntityTask anonymousFunctions = each(ModuleAnalysis::anonymousFunctions, new AnonymousFunctionBuilder());
        EntityTask captures = each(ModuleAnalysis::captures, new CaptureBuilder());
        tasks.put(BuilderKind.ANONYMOUS_FUNCTIONS, (analysis, context) -> {
            List<Triple> triples = new ArrayList<>(anonymousFunctions.build(analysis, context));
            triples.addAll(captures.build(analysis, context));
            return triples;
        });
        tasks.put(BuilderKind.QUOTES, each(ModuleAnalysis::quotes, new QuoteBuilder()));
        tasks.put(BuilderKind.MACRO_INVOCATIONS, each(ModuleAnalysis::macroInvocations, new MacroInvocationBuilder()));
        return tasks;
    }

    private static <T> EntityTask single(Function<ModuleAnalysis, T> select, EntityBuilder<T> builder) {
        return (analysis, context) -> {
            T record = select.apply(analysis);
            return record == null ? List.of() : builder.build(record, context).triples();
        };
    }

    private static <T> EntityTask each(Function<ModuleAnalysis, List<T>> select,
                                       EntityBuilder<T> builder) {
        return (analysis, context) -> {
            List<Triple> triples = new ArrayList<>();
            for (T record : select.apply(analysis)) {
                triples.addAll(builder.build(record, context).triples());
            }
            return triples;
        };
    }

    private static Map<String, Set<FunctionSignature>> declaredCallbacks(List<ModuleAnalysis> analyses) {
        Map<String, Set<FunctionSignature>> declared = new LinkedHashMap<>();
        for (ModuleAnalysis analysis : analyses) {
            if (analysis.behaviour() == null || !analysis.behaviour().definesBehaviour()) {
                continue;
            }
            Set<FunctionSignature> callbacks = new LinkedHashSet<>();
            for (CallbackInfo callback : analysis.behaviour().callbacks()) {
                callbacks.add(callback.signature());
            }
            declared.put(analysis.behaviour().module(), callbacks);
        }
        return declared;
    }
}
