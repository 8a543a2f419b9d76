package com.codeontology.core.model;

import java.util.Optional;

/**
 * Restart strategies of a supervisor.
 */
public enum SupervisorStrategy {
    ONE_FOR_ONE,
    ONE_FOR_ALL,
    REST_FOR_ONE;

    public static Optional<SupervisorStrategy> fromAtom(String atom) {
        if (atom == null) {
            return Optional.empty();
        }
        return switch (atom) {
            case "one_for_one" -> Optional.of(ONE_FOR_ONE);
            case "one_for_all" -> Optional.of(ONE_FOR_ALL);
            case "rest_for_one" -> Optional.of(REST_FOR_ONE);
            default -> Optional.empty();
        };
    }
}
