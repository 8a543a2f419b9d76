package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code defprotocol} definition.
 *
 * @param name protocol module name
 * @param functions declared functions
 * @param fallbackToAny value of {@code @fallback_to_any}
 * @param docstring {@code @moduledoc}, or null
 * @param location source lines, or null
 */
public record ProtocolInfo(
    String name,
    List<ProtocolFunctionInfo> functions,
    boolean fallbackToAny,
    String docstring,
    SourceLocation location
) {
    public ProtocolInfo {
        Objects.requireNonNull(name, "name must not be null");
        functions = functions != null ? List.copyOf(functions) : List.of();
    }
}
