package com.codeontology.core.closure;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;
import java.util.Set;

/**
 * One level of the lexical scope chain around a closure.
 *
 * @param kind scope kind
 * @param name module or function name, or null for anonymous levels
 * @param variables names visible at this level
 * @param location source lines, or null
 */
public record ClosureScope(Kind kind, String name, Set<String> variables, SourceLocation location) {

    /**
     * Scope levels, outermost first.
     */
    public enum Kind {
        /** Module body; values here are module attributes and compile-time bindings. */
        MODULE,
        /** Named function clause. */
        FUNCTION,
        /** Enclosing anonymous function. */
        CLOSURE,
        /** Block construct such as {@code case} or {@code for}. */
        BLOCK
    }

    public ClosureScope {
        Objects.requireNonNull(kind, "kind must not be null");
        variables = variables != null ? Set.copyOf(variables) : Set.of();
    }

    public boolean provides(String variable) {
        return variables.contains(variable);
    }
}
