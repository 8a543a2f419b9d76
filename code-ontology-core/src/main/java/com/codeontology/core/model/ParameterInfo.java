package com.codeontology.core.model;

import com.codeontology.core.ast.SyntaxNode;

import java.util.Objects;

/**
 * One parameter of a function clause.
 *
 * @param position 0-indexed position in the parameter list
 * @param name bound variable name, or null for patterns without a single name
 * @param kind parameter shape
 * @param defaultValue rendered default expression, or null
 * @param pattern the parameter node as written
 */
public record ParameterInfo(
    int position,
    String name,
    ParameterKind kind,
    String defaultValue,
    SyntaxNode pattern
) {
    public ParameterInfo {
        Objects.requireNonNull(kind, "kind must not be null");
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got " + position);
        }
    }

    public boolean hasDefault() {
        return kind == ParameterKind.DEFAULT;
    }
}
