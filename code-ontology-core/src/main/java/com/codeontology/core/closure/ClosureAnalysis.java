package com.codeontology.core.closure;

import java.util.List;

/**
 * Result of analysing one anonymous function.
 *
 * @param freeVariables captured variables, each once, ordered by first reference
 * @param boundVariables names bound by parameters, pins and matches, in binding order
 * @param allReferences every variable read in source order
 */
public record ClosureAnalysis(
    List<FreeVariable> freeVariables,
    List<String> boundVariables,
    List<VariableReference> allReferences
) {
    public ClosureAnalysis {
        freeVariables = freeVariables != null ? List.copyOf(freeVariables) : List.of();
        boundVariables = boundVariables != null ? List.copyOf(boundVariables) : List.of();
        allReferences = allReferences != null ? List.copyOf(allReferences) : List.of();
    }

    public static ClosureAnalysis empty() {
        return new ClosureAnalysis(List.of(), List.of(), List.of());
    }

    public boolean hasCaptures() {
        return !freeVariables.isEmpty();
    }

    public int totalCaptureCount() {
        return freeVariables.size();
    }

    public List<String> freeVariableNames() {
        return freeVariables.stream().map(FreeVariable::name).toList();
    }
}
