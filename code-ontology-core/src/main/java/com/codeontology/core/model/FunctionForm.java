package com.codeontology.core.model;

import java.util.Optional;

/**
 * Definition form of a named function-like entity.
 */
public enum FunctionForm {
    /** {@code def} / {@code defp}. */
    FUNCTION,
    /** {@code defmacro} / {@code defmacrop}. */
    MACRO,
    /** {@code defguard} / {@code defguardp}. */
    GUARD,
    /** {@code defdelegate}. */
    DELEGATE;

    /**
     * Maps a definition keyword to its form.
     *
     * @param keyword definition keyword such as {@code "defp"}
     * @return the form, or empty when the keyword defines no function
     */
    public static Optional<FunctionForm> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return switch (keyword) {
            case "def", "defp" -> Optional.of(FUNCTION);
            case "defmacro", "defmacrop" -> Optional.of(MACRO);
            case "defguard", "defguardp" -> Optional.of(GUARD);
            case "defdelegate" -> Optional.of(DELEGATE);
            default -> Optional.empty();
        };
    }

    /**
     * Returns the visibility implied by a definition keyword.
     *
     * @param keyword definition keyword
     * @return {@link Visibility#PRIVATE} for keywords ending in {@code p}, else public
     */
    public static Visibility visibilityOf(String keyword) {
        return switch (keyword) {
            case "defp", "defmacrop", "defguardp" -> Visibility.PRIVATE;
            default -> Visibility.PUBLIC;
        };
    }
}
