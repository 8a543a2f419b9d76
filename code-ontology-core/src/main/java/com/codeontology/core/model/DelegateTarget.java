package com.codeontology.core.model;

import java.util.Objects;

/**
 * Target of a {@code defdelegate}.
 *
 * @param module target module
 * @param function target function name ({@code as:} option, else the delegating name)
 * @param arity target arity
 */
public record DelegateTarget(String module, String function, int arity) {

    public DelegateTarget {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(function, "function must not be null");
    }
}
