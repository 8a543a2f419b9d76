package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;

import java.util.Objects;

/**
 * A recoverable directive extraction failure.
 *
 * @param kind failure category
 * @param message human-readable description
 * @param location lines of the offending node, or null
 */
public record DirectiveError(Kind kind, String message, SourceLocation location) {

    /**
     * Failure categories.
     */
    public enum Kind {
        /** The node does not have a recognised directive shape. */
        NOT_A_DIRECTIVE,
        /** A multi-target group nests deeper than allowed. */
        MAX_NESTING_DEPTH_EXCEEDED
    }

    public DirectiveError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static DirectiveError notADirective(String message, SourceLocation location) {
        return new DirectiveError(Kind.NOT_A_DIRECTIVE, message, location);
    }
}
