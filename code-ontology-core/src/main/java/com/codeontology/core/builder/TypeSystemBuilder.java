package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.RdfList;
import com.codeontology.core.graph.RdfLists;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.FunctionSpecInfo;
import com.codeontology.core.model.TypeDefinitionInfo;
import com.codeontology.core.model.TypeExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds type definitions, function specs and the type expressions inside them.
 *
 * <p>Type expression IRIs derive from their owner: a type's body is {@code {type}/expr}, spec
 * parameter types are {@code {spec}/param/{i}}, the return type is {@code {spec}/return} and
 * nested elements are {@code {parent}/elem/{i}}. Every expression carries its source text.
 *
 * <p>A {@code @spec} hangs off the function it describes ({@code {function}/spec}); a
 * {@code @callback} or {@code @macrocallback} hangs off the callback declaration.
 */
public class TypeSystemBuilder extends AbstractEntityBuilder<TypeDefinitionInfo> {

    @Override
    public BuildResult build(TypeDefinitionInfo type, BuildContext context) {
        Objects.requireNonNull(type, "type must not be null");
        String module = context.requireModule("TypeSystemBuilder");
        Iri moduleIri = context.moduleIri(module);
        Iri typeIri = IriGenerator.forType(context.baseIri(), module, type.name(), type.arity());

        TripleBuilder triples = new TripleBuilder()
            .type(typeIri, switch (type.visibility()) {
                case PUBLIC -> Structure.PUBLIC_TYPE;
                case PRIVATE -> Structure.PRIVATE_TYPE;
                case OPAQUE -> Structure.OPAQUE_TYPE;
            })
            .string(typeIri, Structure.TYPE_NAME, type.name())
            .nonNegative(typeIri, Structure.TYPE_ARITY, type.arity())
            .bidirectional(typeIri, Structure.BELONGS_TO, moduleIri, Structure.CONTAINS_TYPE);

        addTypeVariables(triples, typeIri, type.parameters());
        if (type.expression() != null) {
            Iri expressionIri = typeIri.resolve("/expr");
            addExpression(triples, expressionIri, type.expression(), context.baseIri());
            triples.link(typeIri, Structure.REFERENCES_TYPE, expressionIri);
        }
        addLocation(triples, typeIri, type.location(), context);
        return result(typeIri, triples, context);
    }

    /**
     * Builds a {@code @spec}, {@code @callback} or {@code @macrocallback}.
     *
     * @param spec extracted spec
     * @param context build context naming the module
     * @return spec IRI and triples
     * @throws IllegalStateException if the context names no module
     */
    public BuildResult buildSpec(FunctionSpecInfo spec, BuildContext context) {
        Objects.requireNonNull(spec, "spec must not be null");
        String module = context.requireModule("TypeSystemBuilder");
        Iri moduleIri = context.moduleIri(module);
        Iri ownerIri = switch (spec.kind()) {
            case SPEC -> IriGenerator.forFunction(context.baseIri(), module, spec.name(), spec.arity());
            case CALLBACK, MACROCALLBACK -> IriGenerator.forCallback(moduleIri, spec.name(), spec.arity());
        };
        Iri specIri = ownerIri.resolve("/spec");

        TripleBuilder triples = new TripleBuilder()
            .type(specIri, switch (spec.kind()) {
                case SPEC -> Structure.FUNCTION_SPEC;
                case CALLBACK -> Structure.CALLBACK_SPEC;
                case MACROCALLBACK -> Structure.MACRO_CALLBACK_SPEC;
            })
            .string(specIri, Structure.FUNCTION_NAME, spec.name())
            .nonNegative(specIri, Structure.ARITY, spec.arity())
            .link(ownerIri, Structure.HAS_SPEC, specIri);
        if (spec.optional()) {
            triples.type(specIri, Structure.OPTIONAL_CALLBACK_SPEC);
        }

        List<Iri> parameterIris = new ArrayList<>();
        for (int i = 0; i < spec.parameterTypes().size(); i++) {
            Iri parameterIri = specIri.resolve("/param/" + i);
            addExpression(triples, parameterIri, spec.parameterTypes().get(i), context.baseIri());
            parameterIris.add(parameterIri);
        }
        RdfList list = RdfLists.build(specIri, "paramTypes", parameterIris);
        triples.link(specIri, Structure.HAS_PARAMETER_TYPE, list.head()).addAll(list.triples());

        if (spec.returnType() != null) {
            Iri returnIri = specIri.resolve("/return");
            addExpression(triples, returnIri, spec.returnType(), context.baseIri());
            triples.link(specIri, Structure.HAS_RETURN_TYPE, returnIri);
        }
        addTypeVariables(triples, specIri, spec.typeVariables());
        addLocation(triples, specIri, spec.location(), context);
        return result(specIri, triples, context);
    }

    private void addTypeVariables(TripleBuilder triples, Iri owner, List<String> names) {
        for (String name : names) {
            Iri variableIri = owner.resolve("/var/" + IriGenerator.escapeName(name));
            triples.type(variableIri, Structure.TYPE_VARIABLE)
                .string(variableIri, Core.NAME, name)
                .link(owner, Structure.HAS_TYPE_VARIABLE, variableIri);
        }
    }

    private void addExpression(TripleBuilder triples, Iri iri, TypeExpression expression, String base) {
        triples.string(iri, Structure.TYPE_EXPRESSION_TEXT, expression.text());
        List<TypeExpression> elements = expression.elements();
        switch (expression.kind()) {
            case BASIC -> triples.type(iri, Structure.BASIC_TYPE).string(iri, Structure.TYPE_NAME, expression.name());
            case VARIABLE -> triples.type(iri, Structure.TYPE_VARIABLE).string(iri, Core.NAME, expression.name());
            case LITERAL -> triples.type(iri, Structure.LITERAL_TYPE);
            case UNION -> {
                triples.type(iri, Structure.UNION_TYPE);
                addElements(triples, iri, elements, Structure.UNION_OF, base);
            }
            case TUPLE -> {
                triples.type(iri, Structure.TUPLE_TYPE);
                addElements(triples, iri, elements, Structure.ELEMENT_TYPE, base);
            }
            case LIST -> {
                triples.type(iri, Structure.LIST_TYPE);
                addElements(triples, iri, elements, Structure.ELEMENT_TYPE, base);
            }
            case PARAMETERIZED -> {
                triples.type(iri, Structure.PARAMETERIZED_TYPE).string(iri, Structure.TYPE_NAME, expression.name());
                addElements(triples, iri, elements, Structure.ELEMENT_TYPE, base);
            }
            case MAP -> {
                triples.type(iri, Structure.MAP_TYPE);
                for (int i = 0; i < elements.size(); i++) {
                    Iri elementIri = iri.resolve("/elem/" + i);
                    addExpression(triples, elementIri, elements.get(i), base);
                    triples.link(iri, i % 2 == 0 ? Structure.KEY_TYPE : Structure.VALUE_TYPE, elementIri);
                }
            }
            case FUNCTION -> {
                triples.type(iri, Structure.FUNCTION_TYPE);
                for (int i = 0; i < elements.size(); i++) {
                    Iri elementIri = iri.resolve("/elem/" + i);
                    addExpression(triples, elementIri, elements.get(i), base);
                    boolean last = i == elements.size() - 1;
                    triples.link(iri, last ? Structure.HAS_RETURN_TYPE : Structure.HAS_PARAMETER_TYPE, elementIri);
                }
            }
            case REMOTE -> {
                triples.type(iri, Structure.REMOTE_TYPE).string(iri, Structure.TYPE_NAME, expression.name());
                if (expression.module() != null && expression.name() != null) {
                    triples.link(iri, Structure.REFERENCES_TYPE,
                        IriGenerator.forType(base, expression.module(), expression.name(), elements.size()));
                }
                addElements(triples, iri, elements, Structure.ELEMENT_TYPE, base);
            }
        }
    }

    private void addElements(TripleBuilder triples, Iri iri, List<TypeExpression> elements, Iri predicate,
                             String base) {
        for (int i = 0; i < elements.size(); i++) {
            Iri elementIri = iri.resolve("/elem/" + i);
            addExpression(triples, elementIri, elements.get(i), base);
            triples.link(iri, predicate, elementIri);
        }
    }
}
