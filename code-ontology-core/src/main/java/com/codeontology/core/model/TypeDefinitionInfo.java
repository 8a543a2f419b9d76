package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code @type}, {@code @typep} or {@code @opaque} definition.
 *
 * @param name type name
 * @param arity number of type parameters
 * @param visibility public, private or opaque
 * @param parameters type parameter names
 * @param expression the defining expression, or null when unparseable
 * @param location source lines, or null
 */
public record TypeDefinitionInfo(
    String name,
    int arity,
    TypeVisibility visibility,
    List<String> parameters,
    TypeExpression expression,
    SourceLocation location
) {
    public TypeDefinitionInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }
}
