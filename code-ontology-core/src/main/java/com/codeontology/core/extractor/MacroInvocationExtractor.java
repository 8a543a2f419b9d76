package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.directive.DirectiveKind;
import com.codeontology.core.model.FunctionInfo;
import com.codeontology.core.model.MacroCategory;
import com.codeontology.core.model.MacroInvocationInfo;
import com.codeontology.core.model.ResolutionStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies macro invocations in a module body.
 *
 * <p>Kernel macros (definitions, control flow, directives, attributes) are recognised from node
 * shapes. Calls into well-known macro libraries and into required modules resolve to those
 * modules. A local call to a macro defined in the same module resolves to the module itself.
 * Invocations are numbered per macro id.
 */
public class MacroInvocationExtractor {

    /** Kernel macros invoked as plain local calls. */
    static final Set<String> CONTROL_FLOW_CALLS = Set.of("raise", "reraise", "throw");

    static final Set<String> OTHER_KERNEL_MACROS = Set.of(
        "binding", "var!", "match?", "destructure", "get_and_update_in", "put_in", "update_in",
        "get_in", "pop_in", "defoverridable", "sigil_C", "sigil_c", "sigil_D", "sigil_N", "sigil_R",
        "sigil_r", "sigil_S", "sigil_s", "sigil_T", "sigil_U", "sigil_W", "sigil_w");

    /** Macro libraries and the macros they provide. */
    static final Map<String, Set<String>> LIBRARY_MACROS = Map.of(
        "Logger", Set.of("debug", "info", "notice", "warning", "warn", "error", "critical", "alert", "emergency"),
        "Ecto.Query", Set.of("from", "where", "select", "join", "order_by", "group_by", "having", "limit",
            "offset", "preload", "distinct", "update", "exclude", "lock", "windows", "combinations",
            "with_cte", "recursive_ctes", "subquery", "dynamic", "fragment", "field", "as", "parent_as"),
        "Phoenix.Router", Set.of("get", "post", "put", "patch", "delete", "options", "head", "connect",
            "trace", "resources", "resource", "scope", "pipe_through", "pipeline", "forward", "live",
            "plug", "socket", "channel"),
        "ExUnit.Case", Set.of("test", "describe", "setup", "setup_all", "assert", "refute",
            "assert_raise", "assert_receive", "refute_receive", "assert_received", "refute_received",
            "flunk", "doctest"));

    /**
     * Extracts macro invocations.
     *
     * @param statements module body statements
     * @param scope module scope
     * @param functions functions of the module, whose macros resolve local invocations
     * @return invocations in pre-order
     */
    public List<MacroInvocationInfo> extract(List<SyntaxNode> statements, ExtractionScope scope,
                                             List<FunctionInfo> functions) {
        Set<String> localMacros = functions.stream()
            .filter(FunctionInfo::isMacro)
            .map(FunctionInfo::name)
            .collect(Collectors.toSet());
        Set<String> imported = scope.modulesOf(DirectiveKind.IMPORT);
        Set<String> required = scope.modulesOf(DirectiveKind.REQUIRE);
        Set<String> used = scope.modulesOf(DirectiveKind.USE);

        List<MacroInvocationInfo> invocations = new ArrayList<>();
        Map<String, Integer> counters = new HashMap<>();
        BodyWalker.walk(statements, false, node ->
            classify(node, scope, localMacros, imported, required, used).ifPresent(candidate -> {
                int index = counters.merge(candidate.macroId(), 1, Integer::sum) - 1;
                invocations.add(new MacroInvocationInfo(candidate.name(), candidate.module(), candidate.arity(),
                    candidate.category(), candidate.status(), index, node.location()));
            }));
        return invocations;
    }

    private static Optional<MacroInvocationInfo> classify(SyntaxNode node, ExtractionScope scope,
                                                          Set<String> localMacros, Set<String> imported,
                                                          Set<String> required, Set<String> used) {
        NodeTag tag = node.tag();
        if (tag == NodeTag.FUNCTION_DEF && node.textValue() != null) {
            return kernel(node.textValue(), node.hasKeyword("do") ? 2 : 1, MacroCategory.DEFINITION);
        }
        if (tag == NodeTag.DEFSTRUCT || tag == NodeTag.DEFEXCEPTION) {
            return kernel(lower(tag), 1, MacroCategory.DEFINITION);
        }
        if (tag.isBlockConstruct()) {
            return kernel(lower(tag), arity(node.children()), MacroCategory.CONTROL_FLOW);
        }
        if (tag.isDirective()) {
            return kernel(lower(tag), arity(node.children()), MacroCategory.IMPORT);
        }
        if (AttributeExtractor.isDefinition(node)) {
            return kernel("@", 1, MacroCategory.ATTRIBUTE);
        }
        if (tag == NodeTag.LOCAL_CALL && node.name() != null) {
            return local(node, scope, localMacros, imported, used);
        }
        if (tag == NodeTag.REMOTE_CALL && node.name() != null && !node.children().isEmpty()) {
            return remote(node, scope, required);
        }
        return Optional.empty();
    }

    private static Optional<MacroInvocationInfo> local(SyntaxNode node, ExtractionScope scope, Set<String> localMacros,
                                                       Set<String> imported, Set<String> used) {
        String name = node.name();
        int arity = arity(node.children());
        if (CONTROL_FLOW_CALLS.contains(name)) {
            return kernel(name, arity, MacroCategory.CONTROL_FLOW);
        }
        if (OTHER_KERNEL_MACROS.contains(name)) {
            return kernel(name, arity, MacroCategory.OTHER);
        }
        if (localMacros.contains(name)) {
            return Optional.of(candidate(name, scope.module(), arity, MacroCategory.CUSTOM, ResolutionStatus.RESOLVED));
        }
        for (Map.Entry<String, Set<String>> library : LIBRARY_MACROS.entrySet()) {
            String module = library.getKey();
            if ((imported.contains(module) || used.contains(module)) && library.getValue().contains(name)) {
                return Optional.of(candidate(name, module, arity, MacroCategory.LIBRARY, ResolutionStatus.RESOLVED));
            }
        }
        return Optional.empty();
    }

    private static Optional<MacroInvocationInfo> remote(SyntaxNode node, ExtractionScope scope, Set<String> required) {
        Optional<String> module = scope.resolveModule(node.children().get(0));
        if (module.isEmpty()) {
            return Optional.empty();
        }
        String name = node.name();
        int arity = arity(node.children().subList(1, node.children().size()));
        Set<String> libraryMacros = LIBRARY_MACROS.getOrDefault(module.get(), Set.of());
        if (libraryMacros.contains(name)) {
            return Optional.of(candidate(name, module.get(), arity, MacroCategory.LIBRARY, ResolutionStatus.RESOLVED));
        }
        if (required.contains(module.get())) {
            return Optional.of(candidate(name, module.get(), arity, MacroCategory.CUSTOM, ResolutionStatus.RESOLVED));
        }
        return Optional.empty();
    }

    private static Optional<MacroInvocationInfo> kernel(String name, int arity, MacroCategory category) {
        return Optional.of(candidate(name, null, arity, category, ResolutionStatus.KERNEL));
    }

    // index and location are filled in by the caller
    private static MacroInvocationInfo candidate(String name, String module, int arity,
                                                 MacroCategory category, ResolutionStatus status) {
        return new MacroInvocationInfo(name, module, arity, category, status, 0, null);
    }

    private static String lower(NodeTag tag) {
        return tag.name().toLowerCase(Locale.ROOT);
    }

    private static int arity(List<SyntaxNode> arguments) {
        long positional = arguments.stream().filter(argument -> !argument.is(NodeTag.KEYWORD)).count();
        boolean keywords = arguments.stream().anyMatch(argument -> argument.is(NodeTag.KEYWORD));
        return (int) positional + (keywords ? 1 : 0);
    }
}
