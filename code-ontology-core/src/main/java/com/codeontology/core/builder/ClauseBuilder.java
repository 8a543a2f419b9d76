package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.RdfList;
import com.codeontology.core.graph.RdfLists;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.ClauseInfo;
import com.codeontology.core.model.ParameterInfo;
import com.codeontology.core.model.ParameterKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds one function clause with its head, parameters, guard and body.
 *
 * <p>Clause order and parameter positions are emitted 1-indexed. The parameters form an
 * ordered RDF list on the head. Guard and body expressions are only built when the context
 * enables {@link BuildContext#INCLUDE_EXPRESSIONS}; each one advances the context counter.
 */
public class ClauseBuilder {

    private final ExpressionBuilder expressions;

    public ClauseBuilder() {
        this(new ExpressionBuilder());
    }

    public ClauseBuilder(ExpressionBuilder expressions) {
        this.expressions = Objects.requireNonNull(expressions, "expressions must not be null");
    }

    /**
     * Builds a clause of the given function.
     *
     * @param functionIri owning function
     * @param clause extracted clause
     * @param context build context
     * @return clause IRI, triples and the context after any counter use
     */
    public BuildResult build(Iri functionIri, ClauseInfo clause, BuildContext context) {
        Objects.requireNonNull(functionIri, "functionIri must not be null");
        Objects.requireNonNull(clause, "clause must not be null");

        Iri clauseIri = IriGenerator.forClause(functionIri, clause.order());
        Iri headIri = clauseIri.resolve("/head");
        Iri bodyIri = clauseIri.resolve("/body");

        TripleBuilder triples = new TripleBuilder()
            .type(clauseIri, Structure.FUNCTION_CLAUSE)
            .positive(clauseIri, Structure.CLAUSE_ORDER, clause.order() + 1)
            .link(functionIri, Structure.HAS_CLAUSE, clauseIri)
            .type(headIri, Structure.FUNCTION_HEAD)
            .link(clauseIri, Structure.HAS_HEAD, headIri)
            .type(bodyIri, Structure.FUNCTION_BODY)
            .link(clauseIri, Structure.HAS_BODY, bodyIri);

        List<Iri> parameterIris = new ArrayList<>();
        for (ParameterInfo parameter : clause.parameters()) {
            parameterIris.add(addParameter(triples, clauseIri, parameter));
        }
        RdfList list = RdfLists.build(headIri, "params", parameterIris);
        triples.link(headIri, Structure.HAS_PARAMETERS, list.head()).addAll(list.triples());

        BuildContext current = context;
        boolean withExpressions = context.includeExpressions();
        if (clause.hasGuard()) {
            if (withExpressions) {
                BuildResult guard = expressions.build(clause.guard(), current);
                current = guard.context();
                triples.addAll(guard.triples())
                    .type(guard.iri(), Core.GUARD_CLAUSE)
                    .link(headIri, Core.HAS_GUARD, guard.iri());
            } else {
                Iri guardIri = headIri.resolve("/guard");
                triples.type(guardIri, Core.GUARD_CLAUSE).link(headIri, Core.HAS_GUARD, guardIri);
            }
        }
        if (withExpressions && clause.hasBody()) {
            BuildResult body = expressions.build(clause.body(), current);
            current = body.context();
            triples.addAll(body.triples()).link(bodyIri, Core.HAS_OPERAND, body.iri());
        }
        return BuildResult.of(clauseIri, triples.build(), current);
    }

    private Iri addParameter(TripleBuilder triples, Iri clauseIri, ParameterInfo parameter) {
        Iri parameterIri = IriGenerator.forParameter(clauseIri, parameter.position());
        triples.type(parameterIri, parameterClass(parameter.kind()))
            .positive(parameterIri, Structure.PARAMETER_POSITION, parameter.position() + 1)
            .string(parameterIri, Structure.PARAMETER_NAME, parameter.name())
            .string(parameterIri, Structure.HAS_DEFAULT_VALUE, parameter.defaultValue());
        return parameterIri;
    }

    static Iri parameterClass(ParameterKind kind) {
        return switch (kind) {
            case SIMPLE -> Structure.PARAMETER;
            case DEFAULT -> Structure.DEFAULT_PARAMETER;
            case PATTERN, PIN -> Structure.PATTERN_PARAMETER;
        };
    }
}
