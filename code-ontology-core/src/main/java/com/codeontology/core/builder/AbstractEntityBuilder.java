package com.codeontology.core.builder;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Abstract base class for entity builders providing common functionality.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Logger initialization (one logger per builder class)</li>
 *   <li>Source location triples ({@link #addLocation(TripleBuilder, Iri, SourceLocation, BuildContext)})</li>
 *   <li>Module context lookup ({@link #moduleIri(BuildContext, String)})</li>
 * </ul>
 *
 * @param <T> record type
 * @see EntityBuilder
 * @since 1.0.0
 */
public abstract class AbstractEntityBuilder<T> implements EntityBuilder<T> {

    /**
     * Logger instance for this builder.
     * Automatically initialized with the concrete builder class name.
     */
    protected final Logger log;

    protected AbstractEntityBuilder() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Adds a source location sub-entity.
     *
     * <p>Nothing is added unless both the location and the context's file path are known.
     *
     * @param triples triple accumulator
     * @param subject located entity
     * @param location source lines, or null
     * @param context build context
     */
    protected void addLocation(TripleBuilder triples, Iri subject, SourceLocation location, BuildContext context) {
        if (location == null) {
            return;
        }
        Optional<Iri> file = context.fileIri();
        if (file.isEmpty()) {
            return;
        }
        Iri locationIri = IriGenerator.forSourceLocation(file.get(), location.startLine(), location.endLine());
        triples.link(subject, Core.HAS_SOURCE_LOCATION, locationIri)
            .type(locationIri, Core.SOURCE_LOCATION)
            .positive(locationIri, Core.START_LINE, location.startLine())
            .positive(locationIri, Core.END_LINE, location.endLine())
            .link(locationIri, Core.IN_SOURCE_FILE, file.get());
    }

    /**
     * Adds only a {@code startLine} property, used by call and control-flow nodes.
     *
     * @param triples triple accumulator
     * @param subject entity
     * @param location source lines, or null
     */
    protected void addStartLine(TripleBuilder triples, Iri subject, SourceLocation location) {
        if (location != null) {
            triples.positive(subject, Core.START_LINE, location.startLine());
        }
    }

    /**
     * Returns the IRI of the module being built.
     *
     * @param context build context
     * @param operation what needs the module, for the error message
     * @return module IRI
     * @throws IllegalStateException if the context names no module
     */
    protected Iri moduleIri(BuildContext context, String operation) {
        return context.moduleIri(context.requireModule(operation));
    }

    protected BuildResult result(Iri iri, TripleBuilder triples, BuildContext context) {
        return BuildResult.of(iri, triples.build(), context);
    }
}
