package com.codeontology.core.model;

import java.util.Locale;

/**
 * Classification of a macro invocation.
 */
public enum MacroCategory {
    DEFINITION,
    CONTROL_FLOW,
    IMPORT,
    ATTRIBUTE,
    LIBRARY,
    CUSTOM,
    OTHER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
