package com.codeontology.core.model;

/**
 * Structural parts a control-flow expression may carry.
 */
public enum ControlFlowFeature {
    CONDITION,
    THEN_BRANCH,
    ELSE_BRANCH,
    ELSE_CLAUSES,
    AFTER_TIMEOUT,
    GENERATOR,
    FILTER,
    INTO,
    REDUCE,
    UNIQ,
    RESCUE,
    CATCH,
    AFTER
}
