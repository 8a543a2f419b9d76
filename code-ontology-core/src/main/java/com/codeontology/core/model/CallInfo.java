package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * A call found in a function body.
 *
 * @param type local, remote or dynamic
 * @param module target module for remote calls (aliases resolved), else null
 * @param name called function name ({@code "apply"} or the variable for dynamic calls)
 * @param arity argument count
 * @param callerFunction enclosing function name
 * @param callerArity enclosing function arity
 * @param index 0-indexed position among the caller's calls
 * @param location source lines, or null
 */
public record CallInfo(
    CallType type,
    String module,
    String name,
    int arity,
    String callerFunction,
    int callerArity,
    int index,
    SourceLocation location
) {
    public CallInfo {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(callerFunction, "callerFunction must not be null");
        if (type == CallType.REMOTE && module == null) {
            throw new IllegalArgumentException("remote call " + name + " needs a module");
        }
    }

    public boolean isLocal() {
        return type == CallType.LOCAL;
    }
}
