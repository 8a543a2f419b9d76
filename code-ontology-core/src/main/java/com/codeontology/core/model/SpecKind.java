package com.codeontology.core.model;

/**
 * Kind of a typespec attribute.
 */
public enum SpecKind {
    /** {@code @spec}. */
    SPEC,
    /** {@code @callback}. */
    CALLBACK,
    /** {@code @macrocallback}. */
    MACROCALLBACK;

    public static SpecKind fromAttribute(String attribute) {
        return switch (attribute) {
            case "callback" -> CALLBACK;
            case "macrocallback" -> MACROCALLBACK;
            default -> SPEC;
        };
    }
}
