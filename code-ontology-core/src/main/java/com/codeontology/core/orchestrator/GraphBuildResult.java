package com.codeontology.core.orchestrator;

import com.codeontology.core.graph.Graph;
import com.codeontology.core.graph.Iri;

import java.util.List;
import java.util.Objects;

/**
 * Graph produced by the orchestrator together with the run report.
 *
 * @param graph deduplicated knowledge graph
 * @param modules IRIs of the modules built, in input order
 * @param report completed and failed builders
 */
public record GraphBuildResult(Graph graph, List<Iri> modules, BuildReport report) {

    public GraphBuildResult {
        Objects.requireNonNull(graph, "graph must not be null");
        modules = modules != null ? List.copyOf(modules) : List.of();
        if (report == null) {
            report = BuildReport.empty();
        }
    }

    /**
     * Returns the IRI of the only module built.
     *
     * @return module IRI
     * @throws IllegalStateException if this result holds several modules or none
     */
    public Iri moduleIri() {
        if (modules.size() != 1) {
            throw new IllegalStateException("Expected exactly one module, got " + modules.size());
        }
        return modules.get(0);
    }
}
