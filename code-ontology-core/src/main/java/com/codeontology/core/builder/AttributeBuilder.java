package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.AttributeInfo;
import com.codeontology.core.model.AttributeKind;

import java.util.Objects;

/**
 * Builds module attribute entities, classified by the attribute's well-known name.
 */
public class AttributeBuilder extends AbstractEntityBuilder<AttributeInfo> {

    @Override
    public BuildResult build(AttributeInfo attribute, BuildContext context) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        String module = context.requireModule("AttributeBuilder");
        Iri moduleIri = context.moduleIri(module);
        Iri attributeIri = IriGenerator.forAttribute(context.baseIri(), module, attribute.name(), attribute.index());

        TripleBuilder triples = new TripleBuilder()
            .type(attributeIri, classOf(attribute.kind()))
            .string(attributeIri, Structure.ATTRIBUTE_NAME, attribute.name())
            .string(attributeIri, Structure.ATTRIBUTE_VALUE, attribute.value())
            .flag(attributeIri, Structure.IS_ACCUMULATING, attribute.accumulating())
            .flag(attributeIri, Structure.IS_DOC_FALSE, attribute.docFalse())
            .bidirectional(attributeIri, Structure.BELONGS_TO, moduleIri, Structure.HAS_ATTRIBUTE);

        if (attribute.kind() == AttributeKind.DEPRECATED) {
            triples.string(attributeIri, Structure.DEPRECATION_MESSAGE, attribute.value());
        } else if (attribute.kind() == AttributeKind.SINCE) {
            triples.string(attributeIri, Structure.SINCE_VERSION, attribute.value());
        }
        addLocation(triples, attributeIri, attribute.location(), context);
        return result(attributeIri, triples, context);
    }

    static Iri classOf(AttributeKind kind) {
        return switch (kind) {
            case DOC -> Structure.FUNCTION_DOC_ATTRIBUTE;
            case MODULEDOC -> Structure.MODULEDOC_ATTRIBUTE;
            case TYPEDOC -> Structure.TYPEDOC_ATTRIBUTE;
            case DEPRECATED -> Structure.DEPRECATED_ATTRIBUTE;
            case SINCE -> Structure.SINCE_ATTRIBUTE;
            case EXTERNAL_RESOURCE -> Structure.EXTERNAL_RESOURCE_ATTRIBUTE;
            case COMPILE -> Structure.COMPILE_ATTRIBUTE;
            case ON_DEFINITION -> Structure.ON_DEFINITION_ATTRIBUTE;
            case BEFORE_COMPILE -> Structure.BEFORE_COMPILE_ATTRIBUTE;
            case AFTER_COMPILE -> Structure.AFTER_COMPILE_ATTRIBUTE;
            case DERIVE -> Structure.DERIVE_ATTRIBUTE;
            case BEHAVIOUR -> Structure.BEHAVIOUR_DECLARATION;
            case CUSTOM -> Structure.MODULE_ATTRIBUTE;
        };
    }
}
