package com.codeontology.core.closure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where a closure's captured variables come from.
 *
 * @param variableSources captured name to the innermost scope providing it, in capture order
 * @param unresolved captured names no scope in the chain provides
 * @param captureDepth largest number of scope levels crossed by a capture, 0 without captures
 * @param crossesFunctionBoundary true when a capture comes from outside an enclosing function
 *                                or closure
 * @param capturesModuleAttributes true when a capture comes from the module level
 */
public record ScopeAnalysis(
    Map<String, ClosureScope> variableSources,
    List<String> unresolved,
    int captureDepth,
    boolean crossesFunctionBoundary,
    boolean capturesModuleAttributes
) {
    public ScopeAnalysis {
        variableSources = variableSources != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(variableSources))
            : Map.of();
        unresolved = unresolved != null ? List.copyOf(unresolved) : List.of();
    }
}
