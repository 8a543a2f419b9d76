package com.codeontology.core.model;

import java.util.Optional;

/**
 * GenServer callbacks with their canonical arities.
 */
public enum GenServerCallbackType {
    INIT("init", 1),
    HANDLE_CALL("handle_call", 3),
    HANDLE_CAST("handle_cast", 2),
    HANDLE_INFO("handle_info", 2),
    HANDLE_CONTINUE("handle_continue", 2),
    TERMINATE("terminate", 2),
    CODE_CHANGE("code_change", 3),
    FORMAT_STATUS("format_status", 1);

    private final String functionName;
    private final int arity;

    GenServerCallbackType(String functionName, int arity) {
        this.functionName = functionName;
        this.arity = arity;
    }

    public String functionName() {
        return functionName;
    }

    public int arity() {
        return arity;
    }

    public static Optional<GenServerCallbackType> of(String name, int arity) {
        for (GenServerCallbackType type : values()) {
            if (type.functionName.equals(name) && type.arity == arity) {
                return Optional.of(type);
            }
        }
        // format_status/2 is the legacy form
        if ("format_status".equals(name) && arity == 2) {
            return Optional.of(FORMAT_STATUS);
        }
        return Optional.empty();
    }
}
