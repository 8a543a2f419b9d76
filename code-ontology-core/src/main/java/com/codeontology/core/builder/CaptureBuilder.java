package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.CaptureInfo;
import com.codeontology.core.model.CaptureKind;

import java.util.Objects;

/**
 * Builds capture expressions.
 *
 * <p>{@code &name/arity} and {@code &Mod.name/arity} become {@code CapturedFunction} entities
 * referring to the captured function; shorthand captures such as {@code &(&1 + 1)} become
 * {@code PartialApplication} entities whose arity is the highest placeholder. IRIs are
 * {@code {Module}/&/{index}}, and the enclosing function or module links to the capture like it
 * does to an anonymous function.
 */
public class CaptureBuilder extends AbstractEntityBuilder<CaptureInfo> {

    @Override
    public BuildResult build(CaptureInfo capture, BuildContext context) {
        Objects.requireNonNull(capture, "capture must not be null");
        String module = context.requireModule("CaptureBuilder");
        Iri moduleIri = context.moduleIri(module);
        Iri captureIri = IriGenerator.forCapture(moduleIri, capture.index());
        Iri containerIri = capture.enclosingFunction() != null && capture.enclosingArity() != null
            ? IriGenerator.forFunction(context.baseIri(), module, capture.enclosingFunction(), capture.enclosingArity())
            : moduleIri;

        TripleBuilder triples = new TripleBuilder()
            .type(captureIri, capture.kind() == CaptureKind.SHORTHAND
                ? Structure.PARTIAL_APPLICATION
                : Structure.CAPTURED_FUNCTION)
            .nonNegative(captureIri, Structure.ARITY, capture.arity())
            .link(containerIri, Structure.CONTAINS_ANONYMOUS_FUNCTION, captureIri);

        switch (capture.kind()) {
            case NAMED_LOCAL -> triples.link(captureIri, Core.REFERS_TO_FUNCTION,
                IriGenerator.forFunction(context.baseIri(), module, capture.function(), capture.arity()));
            case NAMED_REMOTE -> {
                if (capture.module() != null) {
                    triples.link(captureIri, Core.REFERS_TO_MODULE, context.moduleIri(capture.module()))
                        .link(captureIri, Core.REFERS_TO_FUNCTION, IriGenerator.forFunction(
                            context.baseIri(), capture.module(), capture.function(), capture.arity()));
                } else {
                    log.debug("Capture {} of {} has a runtime receiver", capture.index(), capture.function());
                }
            }
            case SHORTHAND -> {
                if (!capture.placeholderGaps().isEmpty()) {
                    log.debug("Capture {} in {} skips placeholders {}", capture.index(), module,
                        capture.placeholderGaps());
                }
            }
        }

        addLocation(triples, captureIri, capture.location(), context);
        return result(captureIri, triples, context);
    }
}
