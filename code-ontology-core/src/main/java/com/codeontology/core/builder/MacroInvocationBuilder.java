package com.codeontology.core.builder;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.MacroInvocationInfo;

import java.util.Objects;
import java.util.Optional;

/**
 * Builds macro invocation sites.
 *
 * <p>IRIs are {@code {Module}/invocation/{macroId}/{index}}, indexed per macro. The call site is
 * linked through {@code invokedAt} when the source file is known, otherwise only its start line
 * is recorded.
 */
public class MacroInvocationBuilder extends AbstractEntityBuilder<MacroInvocationInfo> {

    @Override
    public BuildResult build(MacroInvocationInfo invocation, BuildContext context) {
        Objects.requireNonNull(invocation, "invocation must not be null");
        String module = context.requireModule("MacroInvocationBuilder");
        Iri invocationIri = IriGenerator.forMacroInvocation(context.baseIri(), module, invocation.macroId(),
            invocation.index());

        TripleBuilder triples = new TripleBuilder()
            .type(invocationIri, Structure.MACRO_INVOCATION)
            .string(invocationIri, Structure.MACRO_NAME, invocation.name())
            .string(invocationIri, Structure.MACRO_MODULE, invocation.module())
            .nonNegative(invocationIri, Structure.MACRO_ARITY, invocation.arity())
            .string(invocationIri, Structure.MACRO_CATEGORY, invocation.category().label())
            .string(invocationIri, Structure.RESOLUTION_STATUS, invocation.status().label())
            .link(context.moduleIri(module), Structure.INVOKES_MACRO, invocationIri);

        SourceLocation location = invocation.location();
        Optional<Iri> file = context.fileIri();
        if (location != null && file.isPresent()) {
            Iri locationIri = IriGenerator.forSourceLocation(file.get(), location.startLine(), location.endLine());
            triples.link(invocationIri, Structure.INVOKED_AT, locationIri);
            addLocation(triples, invocationIri, location, context);
        } else {
            addStartLine(triples, invocationIri, location);
        }
        return result(invocationIri, triples, context);
    }
}
