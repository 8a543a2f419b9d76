package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * A macro invocation found in a module.
 *
 * @param name macro name
 * @param module providing module, or null when unresolved
 * @param arity argument count
 * @param category classification
 * @param status resolution status
 * @param index 0-indexed position among invocations of the same macro in the module
 * @param location source lines, or null
 */
public record MacroInvocationInfo(
    String name,
    String module,
    int arity,
    MacroCategory category,
    ResolutionStatus status,
    int index,
    SourceLocation location
) {
    public MacroInvocationInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * Returns the id used in invocation IRIs, {@code Module.name} or the bare name.
     *
     * @return macro id
     */
    public String macroId() {
        return module != null ? module + "." + name : name;
    }
}
