package com.codeontology.core.model;

/**
 * Child process type.
 */
public enum ChildType {
    WORKER,
    SUPERVISOR
}
