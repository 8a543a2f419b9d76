package com.codeontology.core.orchestrator;

import java.util.Objects;

/**
 * A builder that contributed nothing because it failed or timed out.
 *
 * @param module module being built
 * @param kind failed builder kind
 * @param reason failure description
 */
public record BuildFailure(String module, BuilderKind kind, String reason) {

    public BuildFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
