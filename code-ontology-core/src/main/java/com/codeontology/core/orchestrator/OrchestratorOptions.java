package com.codeontology.core.orchestrator;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Options controlling which entity builders run and how.
 *
 * @param include kinds to run; empty means all
 * @param exclude kinds never to run, applied after {@code include}
 * @param parallel run entity builders concurrently
 * @param timeout how long to wait for each concurrent builder
 */
public record OrchestratorOptions(
    Set<BuilderKind> include,
    Set<BuilderKind> exclude,
    boolean parallel,
    Duration timeout
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);

    public OrchestratorOptions {
        include = include == null || include.isEmpty() ? Set.of() : Set.copyOf(include);
        exclude = exclude == null || exclude.isEmpty() ? Set.of() : Set.copyOf(exclude);
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    /**
     * All builders, in parallel, with the default timeout.
     *
     * @return default options
     */
    public static OrchestratorOptions defaults() {
        return new OrchestratorOptions(Set.of(), Set.of(), true, DEFAULT_TIMEOUT);
    }

    public OrchestratorOptions withInclude(Collection<BuilderKind> kinds) {
        return new OrchestratorOptions(kinds == null ? null : Set.copyOf(kinds), exclude, parallel, timeout);
    }

    public OrchestratorOptions withExclude(Collection<BuilderKind> kinds) {
        return new OrchestratorOptions(include, kinds == null ? null : Set.copyOf(kinds), parallel, timeout);
    }

    public OrchestratorOptions withParallel(boolean value) {
        return new OrchestratorOptions(include, exclude, value, timeout);
    }

    public OrchestratorOptions withTimeout(Duration value) {
        return new OrchestratorOptions(include, exclude, parallel, value);
    }

    /**
     * Returns whether a builder kind runs under these options.
     *
     * @param kind builder kind
     * @return true if included and not excluded
     */
    public boolean isEnabled(BuilderKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return (include.isEmpty() || include.contains(kind)) && !exclude.contains(kind);
    }

    /**
     * Returns the enabled kinds in declaration order.
     *
     * @return enabled kinds
     */
    public Set<BuilderKind> enabledKinds() {
        Set<BuilderKind> enabled = EnumSet.noneOf(BuilderKind.class);
        for (BuilderKind kind : BuilderKind.values()) {
            if (isEnabled(kind)) {
                enabled.add(kind);
            }
        }
        return enabled;
    }
}
