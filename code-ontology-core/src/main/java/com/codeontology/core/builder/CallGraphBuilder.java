package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.CallInfo;

import java.util.Objects;

/**
 * Builds call-site entities linking a calling function to the function it calls.
 *
 * <p>Call IRIs are {@code {base}call/{Module}/{caller}/{arity}/{index}}. Local targets resolve
 * in the module being built; dynamic calls have no statically known target and get no
 * {@code callsFunction} link.
 */
public class CallGraphBuilder extends AbstractEntityBuilder<CallInfo> {

    @Override
    public BuildResult build(CallInfo call, BuildContext context) {
        Objects.requireNonNull(call, "call must not be null");
        String module = context.requireModule("CallGraphBuilder");
        String base = context.baseIri();
        Iri callIri = IriGenerator.forCall(base, module, call.callerFunction(), call.callerArity(), call.index());
        Iri callerIri = IriGenerator.forFunction(base, module, call.callerFunction(), call.callerArity());

        TripleBuilder triples = new TripleBuilder()
            .type(callIri, switch (call.type()) {
                case LOCAL -> Core.LOCAL_CALL;
                case REMOTE -> Core.REMOTE_CALL;
                case DYNAMIC -> Core.DYNAMIC_CALL;
            })
            .string(callIri, Structure.FUNCTION_NAME, call.name())
            .nonNegative(callIri, Structure.ARITY, call.arity())
            .string(callIri, Structure.MODULE_NAME, call.module())
            .bidirectional(callIri, Structure.BELONGS_TO, callerIri, Structure.CONTAINS_CALL);

        switch (call.type()) {
            case LOCAL -> triples.link(callIri, Structure.CALLS_FUNCTION,
                IriGenerator.forFunction(base, module, call.name(), call.arity()));
            case REMOTE -> triples.link(callIri, Structure.CALLS_FUNCTION,
                IriGenerator.forFunction(base, call.module(), call.name(), call.arity()));
            case DYNAMIC -> log.trace("Dynamic call {} in {}.{}/{} has no static target",
                call.name(), module, call.callerFunction(), call.callerArity());
        }
        addStartLine(triples, callIri, call.location());
        return result(callIri, triples, context);
    }
}
