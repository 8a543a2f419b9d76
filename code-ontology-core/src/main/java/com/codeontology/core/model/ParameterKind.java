package com.codeontology.core.model;

/**
 * Shape of a function parameter.
 */
public enum ParameterKind {
    /** Plain variable binding. */
    SIMPLE,
    /** Variable with a default value ({@code x \\ 1}). */
    DEFAULT,
    /** Destructuring pattern, literal or wildcard. */
    PATTERN,
    /** Pinned outer value ({@code ^x}). */
    PIN
}
