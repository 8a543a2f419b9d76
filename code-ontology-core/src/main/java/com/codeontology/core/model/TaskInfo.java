package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A module using Task or Task.Supervisor.
 *
 * @param module the module
 * @param kind task flavour
 * @param detection how the usage was recognised
 * @param functionsUsed task functions called, e.g. {@code async/1}, in first-use order
 * @param location lines of the detecting node, or null
 */
public record TaskInfo(
    String module,
    TaskKind kind,
    DetectionMethod detection,
    List<String> functionsUsed,
    SourceLocation location
) {
    public TaskInfo {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(detection, "detection must not be null");
        functionsUsed = functionsUsed != null ? List.copyOf(functionsUsed) : List.of();
    }
}
