package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;

import java.util.List;

/**
 * One clause of a named function.
 *
 * @param order 0-indexed position among the function's clauses
 * @param parameters parameters in declaration order
 * @param guard guard expression, or null
 * @param body body expression, or null for bodiless heads
 * @param location source lines, or null
 */
public record ClauseInfo(
    int order,
    List<ParameterInfo> parameters,
    SyntaxNode guard,
    SyntaxNode body,
    SourceLocation location
) {
    public ClauseInfo {
        if (order < 0) {
            throw new IllegalArgumentException("order must be >= 0, got " + order);
        }
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public int arity() {
        return parameters.size();
    }

    public boolean hasGuard() {
        return guard != null;
    }

    public boolean hasBody() {
        return body != null;
    }
}
