package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code @spec}, {@code @callback} or {@code @macrocallback} signature.
 *
 * @param name specified function name
 * @param arity parameter count
 * @param kind spec kind
 * @param parameterTypes parameter types in order
 * @param returnType return type, or null when unparseable
 * @param typeVariables variables constrained in a {@code when} clause
 * @param optional true when listed in {@code @optional_callbacks}
 * @param location source lines, or null
 */
public record FunctionSpecInfo(
    String name,
    int arity,
    SpecKind kind,
    List<TypeExpression> parameterTypes,
    TypeExpression returnType,
    List<String> typeVariables,
    boolean optional,
    SourceLocation location
) {
    public FunctionSpecInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        parameterTypes = parameterTypes != null ? List.copyOf(parameterTypes) : List.of();
        typeVariables = typeVariables != null ? List.copyOf(typeVariables) : List.of();
    }

    public FunctionSignature signature() {
        return new FunctionSignature(name, arity);
    }

    public FunctionSpecInfo withOptional(boolean value) {
        return new FunctionSpecInfo(name, arity, kind, parameterTypes, returnType, typeVariables, value, location);
    }
}
