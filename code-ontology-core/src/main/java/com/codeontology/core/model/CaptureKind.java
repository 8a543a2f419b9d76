package com.codeontology.core.model;

/**
 * Form of a capture expression.
 */
public enum CaptureKind {
    /** {@code &name/arity}. */
    NAMED_LOCAL,
    /** {@code &Module.name/arity}. */
    NAMED_REMOTE,
    /** {@code &(&1 + 1)}; arity comes from the highest placeholder. */
    SHORTHAND
}
