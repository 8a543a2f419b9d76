package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * A callback declared by a behaviour.
 *
 * @param name callback name
 * @param arity callback arity
 * @param macro true for {@code @macrocallback}
 * @param optional true when listed in {@code @optional_callbacks}
 * @param docstring preceding {@code @doc}, or null
 * @param location source lines, or null
 */
public record CallbackInfo(
    String name,
    int arity,
    boolean macro,
    boolean optional,
    String docstring,
    SourceLocation location
) {
    public CallbackInfo {
        Objects.requireNonNull(name, "name must not be null");
    }

    public FunctionSignature signature() {
        return new FunctionSignature(name, arity);
    }
}
