package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.CallInfo;
import com.codeontology.core.model.CallType;
import com.codeontology.core.model.ClauseInfo;
import com.codeontology.core.model.ControlFlowKind;
import com.codeontology.core.model.FunctionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts local, remote and dynamic calls from function bodies.
 *
 * <p>Arity counts positional arguments plus one for a trailing keyword list. The right-hand
 * side of {@code |>} receives the piped value as an extra first argument. Quoted code is not
 * searched. {@code raise}, {@code throw} and {@code exit} are control flow, not calls.
 */
public class CallExtractor {

    private static final Logger log = LoggerFactory.getLogger(CallExtractor.class);

    /** Local forms that are never recorded as calls. */
    static final Set<String> NON_CALL_FORMS = Set.of(
        "var!", "super", "unquote", "unquote_splicing", "__MODULE__", "__ENV__", "__CALLER__",
        "__DIR__", "__STACKTRACE__", "binding");

    /**
     * Extracts calls of all functions.
     *
     * @param functions functions with their clauses
     * @param scope module scope used to resolve remote receivers
     * @return calls grouped by caller in definition order
     */
    public List<CallInfo> extract(List<FunctionInfo> functions, ExtractionScope scope) {
        List<CallInfo> calls = new ArrayList<>();
        for (FunctionInfo function : functions) {
            Collector collector = new Collector(function, scope);
            for (ClauseInfo clause : function.clauses()) {
                collector.visit(clause.guard());
                collector.visit(clause.body());
            }
            calls.addAll(collector.calls);
        }
        return calls;
    }

    /**
     * Per-caller traversal state.
     */
    private static final class Collector {
        private final FunctionInfo caller;
        private final ExtractionScope scope;
        private final List<CallInfo> calls = new ArrayList<>();

        Collector(FunctionInfo caller, ExtractionScope scope) {
            this.caller = caller;
            this.scope = scope;
        }

        void visit(SyntaxNode node) {
            if (node == null || node.tag().isModuleLike() || node.is(NodeTag.QUOTE)) {
                return;
            }
            if (SyntaxNodes.namedCaptureReference(node).isPresent()) {
                // &name/arity refers to a function without calling it
                return;
            }
            if (node.is(NodeTag.OPERATOR) && "|>".equals(node.name()) && node.children().size() == 2) {
                visit(node.children().get(0));
                SyntaxNode target = node.children().get(1);
                record(target, 1);
                target.children().forEach(this::visit);
                return;
            }
            record(node, 0);
            node.children().forEach(this::visit);
        }

        private void record(SyntaxNode node, int piped) {
            switch (node.tag()) {
                case LOCAL_CALL -> local(node, piped);
                case REMOTE_CALL -> remote(node, piped);
                case DYNAMIC_CALL -> {
                    List<SyntaxNode> children = node.children();
                    String callee = children.isEmpty() || children.get(0).name() == null
                        ? "anonymous"
                        : children.get(0).name();
                    add(CallType.DYNAMIC, null, callee,
                        arity(children.size() > 1 ? children.subList(1, children.size()) : List.of()) + piped, node);
                }
                default -> {
                    // not a call
                }
            }
        }

        private void local(SyntaxNode node, int piped) {
            String name = node.name();
            if (name == null || NON_CALL_FORMS.contains(name) || ControlFlowKind.fromCall(name).isPresent()) {
                return;
            }
            int arity = arity(node.children()) + piped;
            if ("apply".equals(name)) {
                add(CallType.DYNAMIC, null, name, arity, node);
            } else {
                add(CallType.LOCAL, null, name, arity, node);
            }
        }

        private void remote(SyntaxNode node, int piped) {
            if (node.name() == null || node.children().isEmpty()) {
                log.debug("Skipping remote call without receiver at {}", node.location());
                return;
            }
            List<SyntaxNode> children = node.children();
            int arity = arity(children.subList(1, children.size())) + piped;
            Optional<String> module = scope.resolveModule(children.get(0));
            if (module.isPresent()) {
                add(CallType.REMOTE, module.get(), node.name(), arity, node);
            } else {
                // receiver computed at runtime
                add(CallType.DYNAMIC, null, node.name(), arity, node);
            }
        }

        private void add(CallType type, String module, String name, int arity, SyntaxNode node) {
            calls.add(new CallInfo(type, module, name, arity, caller.name(), caller.arity(),
                calls.size(), node.location()));
        }

        private static int arity(List<SyntaxNode> arguments) {
            int positional = 0;
            boolean keywords = false;
            for (SyntaxNode argument : arguments) {
                if (argument.is(NodeTag.KEYWORD)) {
                    keywords = true;
                } else {
                    positional++;
                }
            }
            return positional + (keywords ? 1 : 0);
        }
    }
}
