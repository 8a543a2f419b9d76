package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;

import java.util.List;

/**
 * One clause of an anonymous function.
 *
 * @param parameters parameter patterns
 * @param guard guard expression, or null
 * @param body body expression, or null
 * @param location source lines, or null
 */
public record AnonymousClauseInfo(
    List<SyntaxNode> parameters,
    SyntaxNode guard,
    SyntaxNode body,
    SourceLocation location
) {
    public AnonymousClauseInfo {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public int arity() {
        return parameters.size();
    }

    public boolean hasGuard() {
        return guard != null;
    }
}
