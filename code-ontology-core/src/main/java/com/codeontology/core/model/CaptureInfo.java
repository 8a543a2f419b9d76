package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A capture expression ({@code &...}).
 *
 * @param index 0-indexed position among the module's captures
 * @param kind capture form
 * @param module referenced module for remote captures, Erlang modules with their colon, or null
 * @param function referenced function for named captures, or null
 * @param arity explicit arity, or the highest placeholder for shorthand captures
 * @param placeholders distinct placeholder positions in ascending order
 * @param enclosingFunction name of the enclosing named function, or null at module level
 * @param enclosingArity arity of the enclosing function, or null
 * @param location source lines, or null
 */
public record CaptureInfo(
    int index,
    CaptureKind kind,
    String module,
    String function,
    int arity,
    List<Integer> placeholders,
    String enclosingFunction,
    Integer enclosingArity,
    SourceLocation location
) {
    public CaptureInfo {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got " + index);
        }
        Objects.requireNonNull(kind, "kind must not be null");
        if (arity < 0) {
            throw new IllegalArgumentException("arity must be >= 0, got " + arity);
        }
        placeholders = placeholders != null ? List.copyOf(placeholders) : List.of();
    }

    /**
     * Returns placeholder positions skipped below the highest one, e.g. {@code [2]} for
     * {@code &(&1 + &3)}.
     *
     * @return missing positions in ascending order
     */
    public List<Integer> placeholderGaps() {
        if (kind != CaptureKind.SHORTHAND) {
            return List.of();
        }
        List<Integer> gaps = new ArrayList<>();
        for (int position = 1; position <= arity; position++) {
            if (!placeholders.contains(position)) {
                gaps.add(position);
            }
        }
        return gaps;
    }
}
