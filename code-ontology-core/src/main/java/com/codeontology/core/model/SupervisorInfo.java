package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A module implementing Supervisor or DynamicSupervisor.
 *
 * @param module implementing module
 * @param kind supervisor flavour
 * @param detection how the implementation was recognised
 * @param strategy restart strategy, or null when not found
 * @param maxRestarts {@code max_restarts}, or null when not specified
 * @param maxSeconds {@code max_seconds}, or null when not specified
 * @param children child specifications in order
 * @param location lines of the detecting directive, or null
 */
public record SupervisorInfo(
    String module,
    SupervisorKind kind,
    DetectionMethod detection,
    SupervisorStrategy strategy,
    Integer maxRestarts,
    Integer maxSeconds,
    List<ChildSpecInfo> children,
    SourceLocation location
) {
    /** OTP default for {@code max_restarts}. */
    public static final int DEFAULT_MAX_RESTARTS = 3;
    /** OTP default for {@code max_seconds}. */
    public static final int DEFAULT_MAX_SECONDS = 5;

    public SupervisorInfo {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(detection, "detection must not be null");
        children = children != null ? List.copyOf(children) : List.of();
    }

    public int effectiveMaxRestarts() {
        return maxRestarts != null ? maxRestarts : DEFAULT_MAX_RESTARTS;
    }

    public int effectiveMaxSeconds() {
        return maxSeconds != null ? maxSeconds : DEFAULT_MAX_SECONDS;
    }
}
