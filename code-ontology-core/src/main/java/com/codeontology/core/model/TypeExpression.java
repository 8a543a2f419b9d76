package com.codeontology.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A parsed type expression.
 *
 * @param kind shape
 * @param name type, variable or literal name; null for structural shapes
 * @param module defining module for remote types, else null
 * @param elements member types (union members, tuple elements, map key and value,
 *                 function parameters followed by the return type, type arguments)
 * @param text the expression as written
 */
public record TypeExpression(
    TypeExpressionKind kind,
    String name,
    String module,
    List<TypeExpression> elements,
    String text
) {
    public TypeExpression {
        Objects.requireNonNull(kind, "kind must not be null");
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    public static TypeExpression basic(String name) {
        return new TypeExpression(TypeExpressionKind.BASIC, name, null, List.of(), name + "()");
    }

    public static TypeExpression variable(String name) {
        return new TypeExpression(TypeExpressionKind.VARIABLE, name, null, List.of(), name);
    }
}
