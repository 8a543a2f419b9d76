package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Behaviour facts of one module: the callbacks it declares and the behaviours it adopts.
 *
 * @param module the module
 * @param callbacks declared callbacks; non-empty when the module defines a behaviour
 * @param implementedBehaviours behaviours from {@code @behaviour} and OTP {@code use}
 * @param functions public functions of the module, for callback matching
 * @param location module lines, or null
 */
public record BehaviourInfo(
    String module,
    List<CallbackInfo> callbacks,
    List<String> implementedBehaviours,
    List<FunctionSignature> functions,
    SourceLocation location
) {
    public BehaviourInfo {
        Objects.requireNonNull(module, "module must not be null");
        callbacks = callbacks != null ? List.copyOf(callbacks) : List.of();
        implementedBehaviours = implementedBehaviours != null ? List.copyOf(implementedBehaviours) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
    }

    public boolean definesBehaviour() {
        return !callbacks.isEmpty();
    }

    public boolean implementsAny() {
        return !implementedBehaviours.isEmpty();
    }
}
