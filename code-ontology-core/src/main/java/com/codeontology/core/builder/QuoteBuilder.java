package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.HygieneViolationInfo;
import com.codeontology.core.model.QuoteInfo;
import com.codeontology.core.model.UnquoteInfo;

import java.util.List;
import java.util.Objects;

/**
 * Builds {@code quote} blocks, the unquotes inside them and hygiene violations.
 *
 * <p>{@code unquoteEnabled} is only emitted when a quote passes {@code unquote: false}.
 */
public class QuoteBuilder extends AbstractEntityBuilder<QuoteInfo> {

    @Override
    public BuildResult build(QuoteInfo quote, BuildContext context) {
        Objects.requireNonNull(quote, "quote must not be null");
        String module = context.requireModule("QuoteBuilder");
        Iri quoteIri = IriGenerator.forQuote(context.baseIri(), module, quote.index());

        TripleBuilder triples = new TripleBuilder()
            .type(quoteIri, Structure.QUOTED_EXPRESSION)
            .string(quoteIri, Structure.QUOTE_CONTEXT, quote.context())
            .flag(quoteIri, Structure.HAS_BIND_QUOTED, quote.bindQuoted())
            .flag(quoteIri, Structure.LOCATION_KEEP, quote.locationKeep())
            .flag(quoteIri, Structure.IS_GENERATED, quote.generated());
        if (!quote.unquoteEnabled()) {
            triples.bool(quoteIri, Structure.UNQUOTE_ENABLED, false);
        }

        List<UnquoteInfo> unquotes = quote.unquotes();
        for (int i = 0; i < unquotes.size(); i++) {
            UnquoteInfo unquote = unquotes.get(i);
            Iri unquoteIri = IriGenerator.forUnquote(quoteIri, i);
            triples.type(unquoteIri, unquote.splicing()
                    ? Structure.UNQUOTE_SPLICING_EXPRESSION
                    : Structure.UNQUOTE_EXPRESSION)
                .positive(unquoteIri, Structure.UNQUOTE_DEPTH, unquote.depth())
                .link(quoteIri, Structure.CONTAINS_UNQUOTE, unquoteIri);
            addStartLine(triples, unquoteIri, unquote.location());
        }

        List<HygieneViolationInfo> violations = quote.violations();
        for (int i = 0; i < violations.size(); i++) {
            HygieneViolationInfo violation = violations.get(i);
            Iri violationIri = IriGenerator.forHygieneViolation(quoteIri, i);
            triples.type(violationIri, Structure.HYGIENE)
                .string(violationIri, Structure.VIOLATION_TYPE, violation.type().label())
                .string(violationIri, Structure.UNHYGIENIC_VARIABLE, violation.variable())
                .string(violationIri, Structure.HYGIENE_CONTEXT, violation.context())
                .link(quoteIri, Structure.HAS_HYGIENE_VIOLATION, violationIri);
            addStartLine(triples, violationIri, violation.location());
        }
        addLocation(triples, quoteIri, quote.location(), context);
        return result(quoteIri, triples, context);
    }
}
