package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;

/**
 * A {@code quote} block.
 *
 * @param index 0-indexed position among the module's quotes
 * @param context {@code context:} option, or null
 * @param bindQuoted true when {@code bind_quoted:} is given
 * @param locationKeep true for {@code location: :keep}
 * @param unquoteEnabled false only for {@code unquote: false}
 * @param generated true for {@code generated: true}
 * @param unquotes unquotes in source order
 * @param violations hygiene bypasses in source order
 * @param location source lines, or null
 */
public record QuoteInfo(
    int index,
    String context,
    boolean bindQuoted,
    boolean locationKeep,
    boolean unquoteEnabled,
    boolean generated,
    List<UnquoteInfo> unquotes,
    List<HygieneViolationInfo> violations,
    SourceLocation location
) {
    public QuoteInfo {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
        unquotes = unquotes != null ? List.copyOf(unquotes) : List.of();
        violations = violations != null ? List.copyOf(violations) : List.of();
    }
}
