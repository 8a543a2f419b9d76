package com.codeontology.core.closure;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * One read of a variable.
 *
 * @param name variable name
 * @param location source lines of the read, or null
 */
public record VariableReference(String name, SourceLocation location) {

    public VariableReference {
        Objects.requireNonNull(name, "name must not be null");
    }
}
