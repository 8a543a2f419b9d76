package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.Triple;

import java.util.List;
import java.util.Objects;

/**
 * Output of one {@link EntityBuilder} call.
 *
 * @param iri IRI of the built entity
 * @param triples triples in first-insertion order, without duplicates
 * @param context context to continue with; advanced only when counter values were consumed
 */
public record BuildResult(Iri iri, List<Triple> triples, BuildContext context) {

    public BuildResult {
        Objects.requireNonNull(iri, "iri must not be null");
        Objects.requireNonNull(context, "context must not be null");
        triples = triples != null ? List.copyOf(triples) : List.of();
    }

    public static BuildResult of(Iri iri, List<Triple> triples, BuildContext context) {
        return new BuildResult(iri, triples, context);
    }
}
