package com.codeontology.core.model;

import java.util.Objects;

/**
 * Name and arity of a function, macro, type or callback.
 *
 * @param name entity name
 * @param arity number of parameters
 */
public record FunctionSignature(String name, int arity) {

    public FunctionSignature {
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
