package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;
import java.util.Set;

/**
 * A control-flow or exception expression inside a function body.
 *
 * @param kind expression kind
 * @param function enclosing function name
 * @param arity enclosing function arity
 * @param index 0-indexed position among the enclosing function's control-flow expressions
 * @param clauseCount number of match clauses ({@code case}, {@code cond}, {@code receive}, ...)
 * @param generatorCount number of generators for comprehensions
 * @param features structural parts present
 * @param raisedModule exception module for {@code raise}, or null
 * @param location source lines, or null
 */
public record ControlFlowInfo(
    ControlFlowKind kind,
    String function,
    int arity,
    int index,
    int clauseCount,
    int generatorCount,
    Set<ControlFlowFeature> features,
    String raisedModule,
    SourceLocation location
) {
    public ControlFlowInfo {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(function, "function must not be null");
        features = features != null ? Set.copyOf(features) : Set.of();
    }

    public boolean has(ControlFlowFeature feature) {
        return features.contains(feature);
    }
}
