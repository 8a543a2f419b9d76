package com.codeontology.core.model;

/**
 * Visibility of a type definition.
 */
public enum TypeVisibility {
    /** {@code @type}. */
    PUBLIC,
    /** {@code @typep}. */
    PRIVATE,
    /** {@code @opaque}. */
    OPAQUE;

    public static TypeVisibility fromAttribute(String attribute) {
        return switch (attribute) {
            case "typep" -> PRIVATE;
            case "opaque" -> OPAQUE;
            default -> PUBLIC;
        };
    }
}
