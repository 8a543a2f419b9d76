package com.codeontology.core.model;

/**
 * Ways a quote escapes macro hygiene.
 */
public enum HygieneViolationType {
    /** {@code var!(x)} or {@code var!(x, context)}. */
    VAR_BANG("var_bang"),
    /** {@code Macro.escape(value)}. */
    MACRO_ESCAPE("macro_escape");

    private final String label;

    HygieneViolationType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
