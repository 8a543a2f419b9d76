package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A module using Agent.
 *
 * @param module the module
 * @param detection how the usage was recognised
 * @param functionsUsed {@code Agent} functions called, e.g. {@code get/2}, in first-use order
 * @param location lines of the detecting node, or null
 */
public record AgentInfo(
    String module,
    DetectionMethod detection,
    List<String> functionsUsed,
    SourceLocation location
) {
    public AgentInfo {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(detection, "detection must not be null");
        functionsUsed = functionsUsed != null ? List.copyOf(functionsUsed) : List.of();
    }
}
