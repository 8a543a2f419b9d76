package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * A module attribute definition ({@code @name value}).
 *
 * <p>Type, spec and callback attributes are not attributes here; they become
 * {@link TypeDefinitionInfo} and {@link FunctionSpecInfo} records.
 *
 * @param name attribute name without {@code @}
 * @param kind classification
 * @param value rendered value, or null
 * @param docFalse true for {@code @doc false} and {@code @moduledoc false}
 * @param accumulating true when registered with {@code accumulate: true}
 * @param index 0-indexed position among the module's attributes
 * @param location source lines, or null
 */
public record AttributeInfo(
    String name,
    AttributeKind kind,
    String value,
    boolean docFalse,
    boolean accumulating,
    int index,
    SourceLocation location
) {
    public AttributeInfo {
        Objects.requireNonNull(name, "name must not be null");
        if (kind == null) {
            kind = AttributeKind.fromName(name);
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
    }
}
