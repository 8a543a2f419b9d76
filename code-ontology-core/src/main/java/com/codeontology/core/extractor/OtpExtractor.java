package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.directive.Directive;
import com.codeontology.core.directive.DirectiveKind;
import com.codeontology.core.directive.UseDirective;
import com.codeontology.core.directive.UseOption;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Detects OTP patterns: GenServer, Supervisor, DynamicSupervisor, Agent and Task usage.
 *
 * <p>A module is a GenServer or supervisor when it {@code use}s or declares the behaviour.
 * Agent and Task usage is also detected from calls such as {@code Agent.start_link/1}.
 */
public class OtpExtractor {

    private static final Logger log = LoggerFactory.getLogger(OtpExtractor.class);

    private static final String GEN_SERVER = "GenServer";
    private static final String SUPERVISOR = "Supervisor";
    private static final String DYNAMIC_SUPERVISOR = "DynamicSupervisor";
    private static final String AGENT = "Agent";
    private static final String TASK = "Task";
    private static final String TASK_SUPERVISOR = "Task.Supervisor";

    // ==================== GenServer ====================

    /**
     * Detects a GenServer implementation.
     *
     * @param statements module body statements
     * @param scope module scope
     * @param functions functions of the module
     * @param location module location
     * @return GenServer info, or empty when the module is not a GenServer
     */
    public Optional<GenServerInfo> genServer(List<SyntaxNode> statements, ExtractionScope scope,
                                             List<FunctionInfo> functions, SourceLocation location) {
        Optional<DetectionMethod> detection = detect(statements, scope, GEN_SERVER);
        if (detection.isEmpty()) {
            return Optional.empty();
        }
        List<GenServerCallbackInfo> callbacks = new ArrayList<>();
        for (FunctionInfo function : functions) {
            GenServerCallbackType.of(function.name(), function.arity()).ifPresent(type ->
                callbacks.add(new GenServerCallbackInfo(
                    type, function.arity(), function.clauses().size(), function.location())));
        }
        log.debug("GenServer {} detected by {} with {} callbacks", scope.module(), detection.get(), callbacks.size());
        return Optional.of(new GenServerInfo(
            scope.module(), detection.get(), useOptions(scope, GEN_SERVER), callbacks, location));
    }

    // ==================== Supervisor ====================

    /**
     * Detects a Supervisor or DynamicSupervisor and reads its init options and children.
     *
     * @param statements module body statements
     * @param scope module scope
     * @param location module location
     * @return supervisor info, or empty
     */
    public Optional<SupervisorInfo> supervisor(List<SyntaxNode> statements, ExtractionScope scope,
                                               SourceLocation location) {
        SupervisorKind kind = SupervisorKind.SUPERVISOR;
        String behaviour = SUPERVISOR;
        Optional<DetectionMethod> detection = detect(statements, scope, SUPERVISOR);
        if (detection.isEmpty()) {
            detection = detect(statements, scope, DYNAMIC_SUPERVISOR);
            kind = SupervisorKind.DYNAMIC;
            behaviour = DYNAMIC_SUPERVISOR;
        }
        if (detection.isEmpty()) {
            return Optional.empty();
        }

        SupervisorStrategy strategy = null;
        Integer maxRestarts = null;
        Integer maxSeconds = null;
        List<ChildSpecInfo> children = new ArrayList<>();

        for (SyntaxNode function : statements) {
            if (!function.is(NodeTag.FUNCTION_DEF)) {
                continue;
            }
            List<SyntaxNode> body = SyntaxNodes.body(function);
            for (SyntaxNode init : initCalls(body, scope, behaviour)) {
                List<SyntaxNode> options = options(init);
                strategy = keywordAtom(options, "strategy").flatMap(SupervisorStrategy::fromAtom).orElse(strategy);
                maxRestarts = keywordInteger(options, "max_restarts").orElse(maxRestarts);
                maxSeconds = keywordInteger(options, "max_seconds").orElse(maxSeconds);
                if (kind == SupervisorKind.SUPERVISOR) {
                    childList(init, body).ifPresent(list -> list.children().forEach(entry ->
                        childSpec(entry, scope).ifPresent(children::add)));
                }
            }
        }
        return Optional.of(new SupervisorInfo(
            scope.module(), kind, detection.get(), strategy, maxRestarts, maxSeconds, children, location));
    }

    private static List<SyntaxNode> initCalls(List<SyntaxNode> body, ExtractionScope scope, String behaviour) {
        List<SyntaxNode> calls = new ArrayList<>();
        BodyWalker.walk(body, false, node -> {
            if (node.is(NodeTag.REMOTE_CALL) && "init".equals(node.name()) && !node.children().isEmpty()
                && scope.resolveModule(node.children().get(0)).filter(behaviour::equals).isPresent()) {
                calls.add(node);
            }
        });
        return calls;
    }

    // arguments after the receiver
    private static List<SyntaxNode> arguments(SyntaxNode remoteCall) {
        List<SyntaxNode> children = remoteCall.children();
        return children.size() <= 1 ? List.of() : children.subList(1, children.size());
    }

    private static List<SyntaxNode> options(SyntaxNode call) {
        List<SyntaxNode> options = new ArrayList<>();
        for (SyntaxNode argument : arguments(call)) {
            if (argument.is(NodeTag.KEYWORD)) {
                options.add(argument);
            } else if (argument.is(NodeTag.LIST)) {
                argument.children().stream().filter(child -> child.is(NodeTag.KEYWORD)).forEach(options::add);
            }
        }
        return options;
    }

    private static Optional<String> keywordAtom(List<SyntaxNode> options, String key) {
        return keywordValue(options, key).filter(value -> value.is(NodeTag.ATOM)).map(SyntaxNode::textValue);
    }

    private static Optional<Integer> keywordInteger(List<SyntaxNode> options, String key) {
        return keywordValue(options, key)
            .filter(value -> value.is(NodeTag.INTEGER))
            .map(value -> Integer.valueOf(value.textValue()));
    }

    private static Optional<SyntaxNode> keywordValue(List<SyntaxNode> options, String key) {
        return options.stream()
            .filter(option -> key.equals(option.name()) && !option.children().isEmpty())
            .map(option -> option.children().get(0))
            .findFirst();
    }

    // children list: literal first argument, or a `children = [...]` binding in the same body
    private static Optional<SyntaxNode> childList(SyntaxNode init, List<SyntaxNode> body) {
        List<SyntaxNode> args = arguments(init);
        if (args.isEmpty()) {
            return Optional.empty();
        }
        SyntaxNode first = args.get(0);
        if (first.is(NodeTag.LIST)) {
            return Optional.of(first);
        }
        if (first.is(NodeTag.VARIABLE)) {
            List<SyntaxNode> bound = new ArrayList<>();
            BodyWalker.walk(body, false, node -> {
                if (node.is(NodeTag.MATCH) && node.children().size() == 2
                    && node.children().get(0).is(NodeTag.VARIABLE)
                    && first.name().equals(node.children().get(0).name())
                    && node.children().get(1).is(NodeTag.LIST)) {
                    bound.add(node.children().get(1));
                }
            });
            return bound.isEmpty() ? Optional.empty() : Optional.of(bound.get(bound.size() - 1));
        }
        return Optional.empty();
    }

    private static Optional<ChildSpecInfo> childSpec(SyntaxNode entry, ExtractionScope scope) {
        if (entry.is(NodeTag.MAP)) {
            return mapChildSpec(entry, scope);
        }
        // Module or {Module, args}
        SyntaxNode reference = entry.is(NodeTag.TUPLE) && !entry.children().isEmpty()
            ? entry.children().get(0)
            : entry;
        if (!reference.is(NodeTag.MODULE_NAME)) {
            log.debug("Unrecognized child spec {} at {}", entry.tag(), entry.location());
            return Optional.empty();
        }
        return scope.resolveModule(reference).map(module ->
            new ChildSpecInfo(module, module, null, null, null, entry.location()));
    }

    private static Optional<ChildSpecInfo> mapChildSpec(SyntaxNode map, ExtractionScope scope) {
        String id = null;
        String startModule = null;
        String startFunction = null;
        RestartType restart = null;
        ChildType type = null;
        for (SyntaxNode entry : map.children()) {
            String key;
            SyntaxNode value;
            if (entry.is(NodeTag.KEYWORD) && !entry.children().isEmpty()) {
                key = entry.name();
                value = entry.children().get(0);
            } else if (entry.is(NodeTag.OPERATOR) && "=>".equals(entry.name()) && entry.children().size() == 2
                && entry.children().get(0).is(NodeTag.ATOM)) {
                key = entry.children().get(0).textValue();
                value = entry.children().get(1);
            } else {
                continue;
            }
            switch (key) {
                case "id" -> id = value.is(NodeTag.ATOM) ? value.textValue()
                    : scope.resolveModule(value).orElse(SyntaxNodes.render(value));
                case "start" -> {
                    if (value.is(NodeTag.TUPLE) && value.children().size() >= 2) {
                        startModule = scope.resolveModule(value.children().get(0)).orElse(null);
                        SyntaxNode function = value.children().get(1);
                        startFunction = function.is(NodeTag.ATOM) ? function.textValue() : null;
                    }
                }
                case "restart" -> restart = value.is(NodeTag.ATOM)
                    ? RestartType.fromAtom(value.textValue()).orElse(null)
                    : null;
                case "type" -> type = value.is(NodeTag.ATOM) && "supervisor".equals(value.textValue())
                    ? ChildType.SUPERVISOR
                    : ChildType.WORKER;
                default -> log.trace("Ignoring child spec key {}", key);
            }
        }
        if (startModule == null) {
            log.debug("Child spec map without start module at {}", map.location());
            return Optional.empty();
        }
        return Optional.of(new ChildSpecInfo(
            id != null ? id : startModule, startModule, startFunction, restart, type, map.location()));
    }

    // ==================== Agent and Task ====================

    /**
     * Detects Agent usage.
     *
     * @param statements module body statements
     * @param scope module scope
     * @param location module location
     * @return agent info, or empty
     */
    public Optional<AgentInfo> agent(List<SyntaxNode> statements, ExtractionScope scope, SourceLocation location) {
        List<String> used = functionsUsed(statements, scope, AGENT);
        DetectionMethod detection = scope.uses(AGENT) ? DetectionMethod.USE
            : used.isEmpty() ? null : DetectionMethod.FUNCTION_CALL;
        if (detection == null) {
            return Optional.empty();
        }
        return Optional.of(new AgentInfo(scope.module(), detection, used, location));
    }

    /**
     * Detects Task or Task.Supervisor usage.
     *
     * @param statements module body statements
     * @param scope module scope
     * @param location module location
     * @return task info, or empty
     */
    public Optional<TaskInfo> task(List<SyntaxNode> statements, ExtractionScope scope, SourceLocation location) {
        List<String> supervised = functionsUsed(statements, scope, TASK_SUPERVISOR);
        List<String> plain = functionsUsed(statements, scope, TASK);
        TaskKind kind = supervised.isEmpty() ? TaskKind.TASK : TaskKind.TASK_SUPERVISOR;
        List<String> used = new ArrayList<>(plain);
        used.addAll(supervised);
        DetectionMethod detection = scope.uses(TASK) ? DetectionMethod.USE
            : used.isEmpty() ? null : DetectionMethod.FUNCTION_CALL;
        if (detection == null) {
            return Optional.empty();
        }
        return Optional.of(new TaskInfo(scope.module(), kind, detection, used, location));
    }

    private static List<String> functionsUsed(List<SyntaxNode> statements, ExtractionScope scope, String module) {
        Set<String> used = new LinkedHashSet<>();
        BodyWalker.walk(statements, false, node -> {
            if (node.is(NodeTag.REMOTE_CALL) && node.name() != null && !node.children().isEmpty()
                && scope.resolveModule(node.children().get(0)).filter(module::equals).isPresent()) {
                used.add(node.name() + "/" + (node.children().size() - 1));
            }
        });
        return List.copyOf(used);
    }

    // ==================== Detection ====================

    private static Optional<DetectionMethod> detect(List<SyntaxNode> statements, ExtractionScope scope, String behaviour) {
        if (scope.uses(behaviour)) {
            return Optional.of(DetectionMethod.USE);
        }
        for (SyntaxNode statement : statements) {
            if ((AttributeExtractor.isDefinition(statement, "behaviour")
                || AttributeExtractor.isDefinition(statement, "behavior"))
                && scope.resolveModule(statement.children().get(0)).filter(behaviour::equals).isPresent()) {
                return Optional.of(DetectionMethod.BEHAVIOUR);
            }
        }
        return Optional.empty();
    }

    private static List<String> useOptions(ExtractionScope scope, String used) {
        List<String> options = new ArrayList<>();
        for (Directive directive : scope.directives()) {
            if (directive.kind() == DirectiveKind.USE && used.equals(directive.sourceName())) {
                ((UseDirective) directive).options().stream().map(UseOption::render).forEach(options::add);
            }
        }
        return options;
    }
}
