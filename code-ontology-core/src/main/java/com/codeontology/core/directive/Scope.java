package com.codeontology.core.directive;

import java.util.Locale;

/**
 * Lexical region in which a directive is active.
 */
public enum Scope {
    /** Module body, including block constructs at module level. */
    MODULE,
    /** Inside a named function body. */
    FUNCTION,
    /** Inside a block construct within a function. */
    BLOCK;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
