package com.codeontology.core.orchestrator;

import java.util.Locale;
import java.util.Optional;

/**
 * Entity-phase builder families, each run as one task.
 */
public enum BuilderKind {
    FUNCTIONS,
    PROTOCOLS,
    BEHAVIOURS,
    STRUCTS,
    TYPES,
    GENSERVERS,
    SUPERVISORS,
    AGENTS,
    TASKS,
    CALLS,
    CONTROL_FLOW,
    EXCEPTIONS,
    ANONYMOUS_FUNCTIONS,
    QUOTES,
    MACRO_INVOCATIONS;

    /**
     * Returns the configuration identifier, e.g. {@code control_flow}.
     *
     * @return lower-case identifier
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configuration identifier; case and {@code -} versus {@code _} are ignored.
     *
     * @param id identifier such as {@code macro_invocations}
     * @return matching kind, or empty if unknown
     */
    public static Optional<BuilderKind> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (BuilderKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
