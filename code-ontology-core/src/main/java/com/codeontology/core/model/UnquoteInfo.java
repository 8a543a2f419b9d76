package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

/**
 * An {@code unquote} or {@code unquote_splicing} inside a quote.
 *
 * @param splicing true for {@code unquote_splicing}
 * @param depth quote nesting depth at which it occurs, 1 for the outermost quote
 * @param expression rendered unquoted expression
 * @param location source lines, or null
 */
public record UnquoteInfo(boolean splicing, int depth, String expression, SourceLocation location) {

    public UnquoteInfo {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1, got " + depth);
        }
    }
}
