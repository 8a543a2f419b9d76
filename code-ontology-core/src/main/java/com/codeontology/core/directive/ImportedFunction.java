package com.codeontology.core.directive;

import java.util.Objects;

/**
 * A {@code name: arity} entry of an import selector.
 *
 * @param name function or macro name
 * @param arity arity
 */
public record ImportedFunction(String name, int arity) {

    public ImportedFunction {
        Objects.requireNonNull(name, "name must not be null");
        if (arity < 0) {
            throw new IllegalArgumentException("arity must be >= 0, got " + arity);
        }
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
