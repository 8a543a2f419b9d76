package com.codeontology.core.closure;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A variable an anonymous function captures from its enclosing scope.
 *
 * @param name variable name
 * @param referenceCount number of reads inside the function, nested functions included
 * @param referenceLocations known read locations in source order
 * @param capturedAt location of the capturing function, or null
 */
public record FreeVariable(
    String name,
    int referenceCount,
    List<SourceLocation> referenceLocations,
    SourceLocation capturedAt
) {
    public FreeVariable {
        Objects.requireNonNull(name, "name must not be null");
        if (referenceCount < 1) {
            throw new IllegalArgumentException("referenceCount must be >= 1, got " + referenceCount);
        }
        referenceLocations = referenceLocations != null ? List.copyOf(referenceLocations) : List.of();
    }
}
