package com.codeontology.core.model;

/**
 * How a call names its target.
 */
public enum CallType {
    /** {@code name(args)}. */
    LOCAL,
    /** {@code Module.name(args)}. */
    REMOTE,
    /** {@code var.(args)} or {@code apply/3}. */
    DYNAMIC
}
