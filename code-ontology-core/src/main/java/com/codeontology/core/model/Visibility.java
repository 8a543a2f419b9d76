package com.codeontology.core.model;

/**
 * Visibility of a function, macro or guard.
 */
public enum Visibility {
    /** Callable from other modules ({@code def}, {@code defmacro}, {@code defguard}). */
    PUBLIC,
    /** Module-private ({@code defp}, {@code defmacrop}, {@code defguardp}). */
    PRIVATE
}
