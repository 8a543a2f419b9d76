package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * A deliberate hygiene bypass inside a quote.
 *
 * @param type violation type
 * @param variable variable name for {@code var!}, else null
 * @param context explicit context of {@code var!/2}, else null
 * @param location source lines, or null
 */
public record HygieneViolationInfo(
    HygieneViolationType type,
    String variable,
    String context,
    SourceLocation location
) {
    public HygieneViolationInfo {
        Objects.requireNonNull(type, "type must not be null");
    }
}
