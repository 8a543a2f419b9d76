package com.codeontology.core.builder;

import com.codeontology.core.closure.ClosureAnalysis;
import com.codeontology.core.closure.FreeVariable;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.Triple;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;

import java.util.List;
import java.util.Objects;

/**
 * Emits the variables an anonymous function captures from its enclosing scope.
 */
public class ClosureBuilder {

    /**
     * @param anonymousIri capturing anonymous function
     * @param analysis closure analysis of that function
     * @return one {@code capturesVariable} link and {@code Variable} node per captured name
     */
    public List<Triple> build(Iri anonymousIri, ClosureAnalysis analysis) {
        Objects.requireNonNull(anonymousIri, "anonymousIri must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
        TripleBuilder triples = new TripleBuilder();
        for (FreeVariable variable : analysis.freeVariables()) {
            Iri variableIri = IriGenerator.forCapturedVariable(anonymousIri, variable.name());
            triples.link(anonymousIri, Core.CAPTURES_VARIABLE, variableIri)
                .type(variableIri, Core.VARIABLE)
                .string(variableIri, Core.NAME, variable.name());
        }
        return triples.build();
    }
}
