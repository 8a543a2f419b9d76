package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.ControlFlowFeature;
import com.codeontology.core.model.ControlFlowInfo;
import com.codeontology.core.model.ControlFlowKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds control-flow expressions ({@code if}, {@code case}, {@code try}, ...) found in function
 * bodies.
 *
 * <p>IRIs are {@code {base}{kind}/{Module}/{function}/{arity}/{index}} with the index counted
 * per kind within the function. Structural features become boolean flags.
 */
public class ControlFlowBuilder extends AbstractEntityBuilder<ControlFlowInfo> {

    private static final Map<ControlFlowFeature, Iri> FEATURE_FLAGS = new EnumMap<>(ControlFlowFeature.class);

    static {
        FEATURE_FLAGS.put(ControlFlowFeature.CONDITION, Core.HAS_CONDITION);
        FEATURE_FLAGS.put(ControlFlowFeature.THEN_BRANCH, Core.HAS_THEN_BRANCH);
        FEATURE_FLAGS.put(ControlFlowFeature.ELSE_BRANCH, Core.HAS_ELSE_BRANCH);
        FEATURE_FLAGS.put(ControlFlowFeature.ELSE_CLAUSES, Core.HAS_ELSE_CLAUSE);
        FEATURE_FLAGS.put(ControlFlowFeature.AFTER_TIMEOUT, Core.HAS_AFTER_TIMEOUT);
        FEATURE_FLAGS.put(ControlFlowFeature.GENERATOR, Core.HAS_GENERATOR);
        FEATURE_FLAGS.put(ControlFlowFeature.FILTER, Core.HAS_FILTER);
        FEATURE_FLAGS.put(ControlFlowFeature.INTO, Core.HAS_INTO_OPTION);
        FEATURE_FLAGS.put(ControlFlowFeature.REDUCE, Core.HAS_REDUCE_OPTION);
        FEATURE_FLAGS.put(ControlFlowFeature.UNIQ, Core.HAS_UNIQ_OPTION);
        FEATURE_FLAGS.put(ControlFlowFeature.RESCUE, Core.HAS_RESCUE_CLAUSE);
        FEATURE_FLAGS.put(ControlFlowFeature.CATCH, Core.HAS_CATCH_CLAUSE);
        FEATURE_FLAGS.put(ControlFlowFeature.AFTER, Core.HAS_AFTER_CLAUSE);
    }

    @Override
    public BuildResult build(ControlFlowInfo flow, BuildContext context) {
        Objects.requireNonNull(flow, "flow must not be null");
        String module = context.requireModule("ControlFlowBuilder");
        String base = context.baseIri();
        Iri flowIri = IriGenerator.forControlFlow(base, flow.kind().keyword(), module, flow.function(),
            flow.arity(), flow.index());

        TripleBuilder triples = new TripleBuilder()
            .type(flowIri, expressionClass(flow.kind()))
            .link(IriGenerator.forFunction(base, module, flow.function(), flow.arity()),
                Structure.CONTAINS_CONTROL_FLOW, flowIri);

        for (ControlFlowFeature feature : ControlFlowFeature.values()) {
            if (flow.has(feature)) {
                triples.bool(flowIri, FEATURE_FLAGS.get(feature), true);
            }
        }
        if (flow.clauseCount() > 0) {
            triples.bool(flowIri, Core.HAS_CLAUSE, true)
                .nonNegative(flowIri, Core.CLAUSE_COUNT, flow.clauseCount());
        }
        if (flow.kind() == ControlFlowKind.FOR || flow.kind() == ControlFlowKind.WITH) {
            triples.nonNegative(flowIri, Core.GENERATOR_COUNT, flow.generatorCount());
        }
        if (flow.raisedModule() != null) {
            triples.link(flowIri, Core.REFERS_TO_MODULE, context.moduleIri(flow.raisedModule()));
        }
        addStartLine(triples, flowIri, flow.location());
        return result(flowIri, triples, context);
    }

    static Iri expressionClass(ControlFlowKind kind) {
        return switch (kind) {
            case IF -> Core.IF_EXPRESSION;
            case UNLESS -> Core.UNLESS_EXPRESSION;
            case COND -> Core.COND_EXPRESSION;
            case CASE -> Core.CASE_EXPRESSION;
            case WITH -> Core.WITH_EXPRESSION;
            case RECEIVE -> Core.RECEIVE_EXPRESSION;
            case FOR -> Core.FOR_COMPREHENSION;
            case TRY -> Core.TRY_EXPRESSION;
            case RAISE -> Core.RAISE_EXPRESSION;
            case THROW -> Core.THROW_EXPRESSION;
            case EXIT -> Core.EXIT_EXPRESSION;
        };
    }
}
