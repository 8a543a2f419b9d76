package com.codeontology.core.orchestrator;

/**
 * Phases of one orchestrator run, in order.
 */
public enum OrchestratorState {
    START,
    MODULE_PHASE,
    ENTITY_PHASE,
    AGGREGATE,
    DONE
}
