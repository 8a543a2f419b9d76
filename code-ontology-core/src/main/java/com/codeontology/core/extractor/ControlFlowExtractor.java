package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.model.ClauseInfo;
import com.codeontology.core.model.ControlFlowFeature;
import com.codeontology.core.model.ControlFlowInfo;
import com.codeontology.core.model.ControlFlowKind;
import com.codeontology.core.model.FunctionInfo;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts control-flow and exception expressions from function bodies.
 *
 * <p>Expressions are numbered per enclosing function in pre-order across all clauses. Quoted code
 * is not searched.
 */
public class ControlFlowExtractor {

    /**
     * Extracts control flow of all functions.
     *
     * @param functions functions with their clauses
     * @param scope module scope used to resolve raised exception modules
     * @return control-flow expressions grouped by function
     */
    public List<ControlFlowInfo> extract(List<FunctionInfo> functions, ExtractionScope scope) {
        List<ControlFlowInfo> result = new ArrayList<>();
        for (FunctionInfo function : functions) {
            List<ControlFlowInfo> found = new ArrayList<>();
            for (ClauseInfo clause : function.clauses()) {
                BodyWalker.walk(bodyOf(clause), false, node ->
                    describe(node, function, found.size(), scope).ifPresent(found::add));
            }
            result.addAll(found);
        }
        return result;
    }

    private static List<SyntaxNode> bodyOf(ClauseInfo clause) {
        List<SyntaxNode> nodes = new ArrayList<>(2);
        if (clause.guard() != null) {
            nodes.add(clause.guard());
        }
        if (clause.body() != null) {
            nodes.add(clause.body());
        }
        return nodes;
    }

    private static Optional<ControlFlowInfo> describe(SyntaxNode node, FunctionInfo function, int index,
                                                      ExtractionScope scope) {
        if (node.is(NodeTag.LOCAL_CALL)) {
            return ControlFlowKind.fromCall(node.name()).map(kind -> new ControlFlowInfo(
                kind, function.name(), function.arity(), index, 0, 0, Set.of(),
                kind == ControlFlowKind.RAISE ? raisedModule(node, scope) : null,
                node.location()));
        }
        return ControlFlowKind.fromTag(node.tag()).map(kind -> {
            Set<ControlFlowFeature> features = EnumSet.noneOf(ControlFlowFeature.class);
            int clauseCount = 0;
            int generatorCount = 0;
            List<SyntaxNode> positional = node.positional();
            switch (kind) {
                case IF, UNLESS -> {
                    flag(features, !positional.isEmpty(), ControlFlowFeature.CONDITION);
                    flag(features, node.hasKeyword("do"), ControlFlowFeature.THEN_BRANCH);
                    flag(features, node.hasKeyword("else"), ControlFlowFeature.ELSE_BRANCH);
                }
                case CASE -> {
                    flag(features, !positional.isEmpty(), ControlFlowFeature.CONDITION);
                    clauseCount = clauses(node, "do");
                }
                case COND, RECEIVE -> {
                    clauseCount = clauses(node, "do");
                    flag(features, node.hasKeyword("after"), ControlFlowFeature.AFTER_TIMEOUT);
                }
                case WITH -> {
                    clauseCount = (int) positional.stream().filter(ControlFlowExtractor::isArrow).count();
                    flag(features, node.hasKeyword("do"), ControlFlowFeature.THEN_BRANCH);
                    flag(features, node.hasKeyword("else"), ControlFlowFeature.ELSE_CLAUSES);
                }
                case FOR -> {
                    generatorCount = (int) positional.stream().filter(ControlFlowExtractor::isArrow).count();
                    flag(features, generatorCount > 0, ControlFlowFeature.GENERATOR);
                    flag(features, positional.size() > generatorCount, ControlFlowFeature.FILTER);
                    flag(features, node.hasKeyword("into"), ControlFlowFeature.INTO);
                    flag(features, node.hasKeyword("reduce"), ControlFlowFeature.REDUCE);
                    flag(features, node.hasKeyword("uniq"), ControlFlowFeature.UNIQ);
                }
                case TRY -> {
                    flag(features, node.hasKeyword("rescue"), ControlFlowFeature.RESCUE);
                    flag(features, node.hasKeyword("catch"), ControlFlowFeature.CATCH);
                    flag(features, node.hasKeyword("after"), ControlFlowFeature.AFTER);
                    flag(features, node.hasKeyword("else"), ControlFlowFeature.ELSE_CLAUSES);
                    clauseCount = clauses(node, "rescue") + clauses(node, "catch");
                }
                default -> {
                    // raise, throw and exit are calls
                }
            }
            return new ControlFlowInfo(kind, function.name(), function.arity(), index, clauseCount,
                generatorCount, features, null, node.location());
        });
    }

    private static void flag(Set<ControlFlowFeature> features, boolean present, ControlFlowFeature feature) {
        if (present) {
            features.add(feature);
        }
    }

    private static int clauses(SyntaxNode node, String label) {
        return (int) node.keywordValues(label).stream().filter(child -> child.is(NodeTag.CLAUSE)).count();
    }

    private static boolean isArrow(SyntaxNode node) {
        return node.is(NodeTag.OPERATOR) && "<-".equals(node.name());
    }

    private static String raisedModule(SyntaxNode raise, ExtractionScope scope) {
        List<SyntaxNode> args = raise.positional();
        if (args.isEmpty() || !args.get(0).is(NodeTag.MODULE_NAME)) {
            return null;
        }
        return scope.resolveModule(args.get(0)).orElse(null);
    }
}
