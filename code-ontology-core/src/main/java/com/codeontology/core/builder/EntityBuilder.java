package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;

/**
 * Transforms one extracted record into RDF triples.
 *
 * <p>Implementations compute the entity IRI from its logical path, emit exactly one type triple
 * for the most specific class, emit scalar properties only when present and link the entity to
 * its owner in both directions. Builders never modify their input and return the same triples
 * for the same input.
 *
 * <p>A builder that consumes expression counter values returns the advanced context in
 * {@link BuildResult#context()}; all others return the context they were given.
 *
 * @param <T> record type
 * @see AbstractEntityBuilder
 * @since 1.0.0
 */
public interface EntityBuilder<T> {

    /**
     * Builds the triples of one record.
     *
     * @param record extracted record
     * @param context build context
     * @return entity IRI, triples and the context to continue with
     * @throws IllegalStateException if the context lacks module information the entity needs
     */
    BuildResult build(T record, BuildContext context);
}
