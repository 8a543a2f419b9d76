package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.ProtocolFunctionInfo;
import com.codeontology.core.model.ProtocolImplementationInfo;
import com.codeontology.core.model.ProtocolInfo;

import java.util.Objects;

/**
 * Builds protocol definitions and protocol implementations.
 *
 * <p>Implementations are identified as {@code {base}{Protocol}.for.{Type}}. Their functions are
 * the functions of the implementation module {@code Protocol.Type}.
 */
public class ProtocolBuilder extends AbstractEntityBuilder<ProtocolInfo> {

    @Override
    public BuildResult build(ProtocolInfo protocol, BuildContext context) {
        Objects.requireNonNull(protocol, "protocol must not be null");
        Iri protocolIri = context.moduleIri(protocol.name());

        TripleBuilder triples = new TripleBuilder()
            .type(protocolIri, Structure.PROTOCOL)
            .string(protocolIri, Structure.PROTOCOL_NAME, protocol.name())
            .bool(protocolIri, Structure.FALLBACK_TO_ANY, protocol.fallbackToAny())
            .string(protocolIri, Structure.DOCSTRING, protocol.docstring());

        for (ProtocolFunctionInfo function : protocol.functions()) {
            Iri functionIri = IriGenerator.forFunction(context.baseIri(), protocol.name(), function.name(),
                function.arity());
            triples.type(functionIri, Structure.PROTOCOL_FUNCTION)
                .string(functionIri, Structure.FUNCTION_NAME, function.name())
                .nonNegative(functionIri, Structure.ARITY, function.arity())
                .string(functionIri, Structure.DOCSTRING, function.docstring())
                .link(protocolIri, Structure.DEFINES_PROTOCOL_FUNCTION, functionIri);
            addLocation(triples, functionIri, function.location(), context);
        }
        addLocation(triples, protocolIri, protocol.location(), context);
        return result(protocolIri, triples, context);
    }

    /**
     * Builds one {@code defimpl} target.
     *
     * @param implementation extracted implementation
     * @param context build context
     * @return implementation IRI and triples
     */
    public BuildResult buildImplementation(ProtocolImplementationInfo implementation, BuildContext context) {
        Objects.requireNonNull(implementation, "implementation must not be null");
        Iri implementationIri = IriGenerator.forProtocolImplementation(
            context.baseIri(), implementation.protocol(), implementation.forType());
        String implementationModule = implementation.protocol() + "." + implementation.forType();

        TripleBuilder triples = new TripleBuilder()
            .type(implementationIri, Structure.PROTOCOL_IMPLEMENTATION)
            .link(implementationIri, Structure.IMPLEMENTS_PROTOCOL, context.moduleIri(implementation.protocol()))
            .link(implementationIri, Structure.FOR_DATA_TYPE, context.moduleIri(implementation.forType()));
        for (FunctionSignature function : implementation.functions()) {
            triples.link(implementationIri, Structure.CONTAINS_FUNCTION, IriGenerator.forFunction(
                context.baseIri(), implementationModule, function.name(), function.arity()));
        }
        addLocation(triples, implementationIri, implementation.location(), context);
        return result(implementationIri, triples, context);
    }
}
