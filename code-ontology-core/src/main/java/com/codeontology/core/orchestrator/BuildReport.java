package com.codeontology.core.orchestrator;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one or more orchestrator runs.
 *
 * @param completed builder kinds that finished, per run in completion order
 * @param failures builders that failed or timed out
 * @param states phases passed through by the last run
 */
public record BuildReport(
    List<BuilderKind> completed,
    List<BuildFailure> failures,
    List<OrchestratorState> states
) {
    public BuildReport {
        completed = completed != null ? List.copyOf(completed) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
        states = states != null ? List.copyOf(states) : List.of();
    }

    public static BuildReport empty() {
        return new BuildReport(List.of(), List.of(), List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Combines this report with a later one.
     *
     * @param other later report
     * @return report with both runs' outcomes and the later run's states
     */
    public BuildReport merge(BuildReport other) {
        List<BuilderKind> allCompleted = new ArrayList<>(completed);
        allCompleted.addAll(other.completed());
        List<BuildFailure> allFailures = new ArrayList<>(failures);
        allFailures.addAll(other.failures());
        return new BuildReport(allCompleted, allFailures, other.states().isEmpty() ? states : other.states());
    }
}
