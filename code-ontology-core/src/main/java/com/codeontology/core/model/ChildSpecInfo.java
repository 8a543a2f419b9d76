package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * One entry of a supervisor's children list.
 *
 * @param id child id (defaults to the start module)
 * @param startModule module started by the child
 * @param startFunction start function, {@code start_link} unless specified
 * @param restart restart value, or null when not specified
 * @param type worker or supervisor
 * @param location source lines, or null
 */
public record ChildSpecInfo(
    String id,
    String startModule,
    String startFunction,
    RestartType restart,
    ChildType type,
    SourceLocation location
) {
    public ChildSpecInfo {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(startModule, "startModule must not be null");
        if (startFunction == null) {
            startFunction = "start_link";
        }
        if (type == null) {
            type = ChildType.WORKER;
        }
    }
}
