package com.codeontology.core.model;

/**
 * Task flavour.
 */
public enum TaskKind {
    /** {@code Task}. */
    TASK,
    /** {@code Task.Supervisor}. */
    TASK_SUPERVISOR
}
