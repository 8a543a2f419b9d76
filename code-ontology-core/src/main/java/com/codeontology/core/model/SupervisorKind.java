package com.codeontology.core.model;

/**
 * Supervisor flavour.
 */
public enum SupervisorKind {
    /** {@code Supervisor}. */
    SUPERVISOR,
    /** {@code DynamicSupervisor}. */
    DYNAMIC
}
