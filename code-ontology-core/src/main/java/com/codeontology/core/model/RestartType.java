package com.codeontology.core.model;

import java.util.Optional;

/**
 * Child restart values.
 */
public enum RestartType {
    PERMANENT,
    TEMPORARY,
    TRANSIENT;

    public static Optional<RestartType> fromAtom(String atom) {
        if (atom == null) {
            return Optional.empty();
        }
        return switch (atom) {
            case "permanent" -> Optional.of(PERMANENT);
            case "temporary" -> Optional.of(TEMPORARY);
            case "transient" -> Optional.of(TRANSIENT);
            default -> Optional.empty();
        };
    }
}
