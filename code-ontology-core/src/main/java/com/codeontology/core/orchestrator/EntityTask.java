package com.codeontology.core.orchestrator;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Triple;
import com.codeontology.core.model.ModuleAnalysis;

import java.util.List;

/**
 * Builds the triples of one builder kind for one module.
 */
@FunctionalInterface
public interface EntityTask {

    /**
     * @param analysis extracted module
     * @param context context naming the module, counter reset
     * @return triples contributed by this kind
     * @throws Exception any failure; the orchestrator records it and drops the contribution
     */
    List<Triple> build(ModuleAnalysis analysis, BuildContext context) throws Exception;
}
