package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code defimpl Protocol, for: Type} block.
 *
 * @param protocol implemented protocol
 * @param forType data type the implementation is for
 * @param functions functions defined in the block
 * @param location source lines, or null
 */
public record ProtocolImplementationInfo(
    String protocol,
    String forType,
    List<FunctionSignature> functions,
    SourceLocation location
) {
    public ProtocolImplementationInfo {
        Objects.requireNonNull(protocol, "protocol must not be null");
        Objects.requireNonNull(forType, "forType must not be null");
        functions = functions != null ? List.copyOf(functions) : List.of();
    }
}
