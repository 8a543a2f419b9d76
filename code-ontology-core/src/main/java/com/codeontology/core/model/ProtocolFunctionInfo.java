package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A function signature declared inside {@code defprotocol}.
 *
 * @param name function name
 * @param arity arity
 * @param parameters parameter names as written
 * @param docstring preceding {@code @doc}, or null
 * @param location source lines, or null
 */
public record ProtocolFunctionInfo(
    String name,
    int arity,
    List<String> parameters,
    String docstring,
    SourceLocation location
) {
    public ProtocolFunctionInfo {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }
}
