package com.codeontology.core.model;

/**
 * How an OTP pattern was recognised in a module.
 */
public enum DetectionMethod {
    /** {@code use GenServer} and friends. */
    USE,
    /** {@code @behaviour GenServer} and friends. */
    BEHAVIOUR,
    /** Calls into the pattern's API module only. */
    FUNCTION_CALL
}
