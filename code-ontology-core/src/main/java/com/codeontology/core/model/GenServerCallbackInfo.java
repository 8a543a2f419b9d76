package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * A GenServer callback implemented by a module.
 *
 * @param type callback type
 * @param arity implemented arity
 * @param clauseCount number of clauses
 * @param location lines of the first clause, or null
 */
public record GenServerCallbackInfo(
    GenServerCallbackType type,
    int arity,
    int clauseCount,
    SourceLocation location
) {
    public GenServerCallbackInfo {
        Objects.requireNonNull(type, "type must not be null");
    }
}
