package com.codeontology.core.closure;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Variable binding rules for patterns.
 *
 * <p>A pattern binds every variable it mentions except underscore-prefixed names, special
 * forms and pinned variables. Pinned variables ({@code ^x}) are reported separately: they
 * read an existing binding instead of creating one.
 */
public final class Bindings {

    /** Names that look like variables but are compile-time forms. */
    public static final Set<String> SPECIAL_FORMS =
        Set.of("__MODULE__", "__ENV__", "__CALLER__", "__DIR__", "__STACKTRACE__");

    private Bindings() {
        // Utility class - no instantiation
    }

    /**
     * Returns true if {@code name} takes part in binding and capture analysis.
     *
     * @param name variable name
     * @return false for null, underscore-prefixed names and special forms
     */
    public static boolean isTrackedVariable(String name) {
        return name != null && !name.isEmpty() && !name.startsWith("_") && !SPECIAL_FORMS.contains(name);
    }

    /**
     * Returns the names a pattern binds, in order of first appearance.
     *
     * @param pattern pattern node
     * @return bound names
     */
    public static Set<String> boundBy(SyntaxNode pattern) {
        Set<String> bound = new LinkedHashSet<>();
        collect(pattern, bound, new ArrayList<>());
        return bound;
    }

    /**
     * Collects the variables bound by {@code pattern} and the pinned variable nodes it reads.
     *
     * @param pattern pattern node, may be null
     * @param bound receives bound names
     * @param pinned receives the {@code VARIABLE} nodes under pins
     */
    public static void collect(SyntaxNode pattern, Set<String> bound, List<SyntaxNode> pinned) {
        if (pattern == null) {
            return;
        }
        switch (pattern.tag()) {
            case VARIABLE -> {
                if (isTrackedVariable(pattern.name())) {
                    bound.add(pattern.name());
                }
            }
            case PIN -> {
                for (SyntaxNode child : pattern.children()) {
                    if (child.is(NodeTag.VARIABLE) && isTrackedVariable(child.name())) {
                        pinned.add(child);
                    }
                }
            }
            case OPERATOR -> {
                // `e in Error` and `x \\ default` bind on the left only
                if (isLeftBindingOperator(pattern.name())) {
                    if (!pattern.children().isEmpty()) {
                        collect(pattern.children().get(0), bound, pinned);
                    }
                } else {
                    pattern.children().forEach(child -> collect(child, bound, pinned));
                }
            }
            case WILDCARD, ATTRIBUTE, MODULE_NAME, QUOTE -> {
                // binds nothing
            }
            default -> {
                if (!pattern.tag().isLiteral()) {
                    pattern.children().forEach(child -> collect(child, bound, pinned));
                }
            }
        }
    }

    static boolean isLeftBindingOperator(String symbol) {
        return "in".equals(symbol) || "\\\\".equals(symbol);
    }
}
