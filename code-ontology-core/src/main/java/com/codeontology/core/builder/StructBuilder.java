package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.ExceptionInfo;
import com.codeontology.core.model.StructField;
import com.codeontology.core.model.StructInfo;

import java.util.List;
import java.util.Objects;

/**
 * Builds struct and exception entities.
 *
 * <p>A struct shares the IRI of its defining module. Each field is a {@code StructField}
 * at {@code {struct}/field/{name}}; enforced fields are additionally typed {@code EnforcedKey}.
 */
public class StructBuilder extends AbstractEntityBuilder<StructInfo> {

    @Override
    public BuildResult build(StructInfo struct, BuildContext context) {
        Objects.requireNonNull(struct, "struct must not be null");
        Iri structIri = context.moduleIri(struct.module());

        TripleBuilder triples = new TripleBuilder()
            .type(structIri, Structure.STRUCT)
            .link(structIri, Structure.CONTAINS_STRUCT, structIri);
        addFields(triples, structIri, struct.fields());
        for (String protocol : struct.derivedProtocols()) {
            triples.link(structIri, Structure.DERIVES_PROTOCOL, context.moduleIri(protocol));
        }
        addLocation(triples, structIri, struct.location(), context);
        return result(structIri, triples, context);
    }

    /**
     * Builds a {@code defexception} module.
     *
     * @param exception extracted exception
     * @param context build context
     * @return exception IRI (the module IRI) and triples
     */
    public BuildResult buildException(ExceptionInfo exception, BuildContext context) {
        Objects.requireNonNull(exception, "exception must not be null");
        Iri exceptionIri = context.moduleIri(exception.module());

        TripleBuilder triples = new TripleBuilder()
            .type(exceptionIri, Structure.EXCEPTION)
            .link(exceptionIri, Structure.CONTAINS_STRUCT, exceptionIri)
            .string(exceptionIri, Structure.EXCEPTION_MESSAGE, exception.defaultMessage());
        addFields(triples, exceptionIri, exception.fields());
        addLocation(triples, exceptionIri, exception.location(), context);
        if (exception.customMessage()) {
            log.trace("{} overrides message/1", exception.module());
        }
        return result(exceptionIri, triples, context);
    }

    private void addFields(TripleBuilder triples, Iri ownerIri, List<StructField> fields) {
        for (StructField field : fields) {
            Iri fieldIri = IriGenerator.forStructField(ownerIri, field.name());
            triples.type(fieldIri, Structure.STRUCT_FIELD)
                .string(fieldIri, Structure.FIELD_NAME, field.name())
                .link(ownerIri, Structure.HAS_FIELD, fieldIri);
            if (field.hasDefault()) {
                triples.string(fieldIri, Structure.HAS_DEFAULT_FIELD_VALUE,
                    field.defaultValue() != null ? field.defaultValue() : "nil");
            }
            if (field.enforced()) {
                triples.type(fieldIri, Structure.ENFORCED_KEY)
                    .link(ownerIri, Structure.HAS_ENFORCED_KEY, fieldIri);
            }
        }
    }
}
