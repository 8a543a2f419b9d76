package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;

/**
 * An anonymous function ({@code fn ... end}).
 *
 * @param index 0-indexed position among the module's anonymous functions
 * @param clauses clauses in source order
 * @param enclosingFunction name of the enclosing named function, or null at module level
 * @param enclosingArity arity of the enclosing function, or null
 * @param location source lines, or null
 */
public record AnonymousFunctionInfo(
    int index,
    List<AnonymousClauseInfo> clauses,
    String enclosingFunction,
    Integer enclosingArity,
    SourceLocation location
) {
    public AnonymousFunctionInfo {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
        clauses = clauses != null ? List.copyOf(clauses) : List.of();
    }

    /**
     * Returns the arity of the first clause; all clauses of a valid function agree.
     *
     * @return arity, 0 when there are no clauses
     */
    public int arity() {
        return clauses.isEmpty() ? 0 : clauses.get(0).arity();
    }
}
