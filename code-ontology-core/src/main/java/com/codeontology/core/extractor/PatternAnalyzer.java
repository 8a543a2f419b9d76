package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.closure.Bindings;
import com.codeontology.core.model.ParameterInfo;
import com.codeontology.core.model.ParameterKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Classifies parameter patterns.
 */
public final class PatternAnalyzer {

    private PatternAnalyzer() {
        // Utility class - no instantiation
    }

    /**
     * Describes each parameter of a clause.
     *
     * @param params parameter nodes in order
     * @return parameter records, positions 0-indexed
     */
    public static List<ParameterInfo> parameters(List<SyntaxNode> params) {
        List<ParameterInfo> result = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            result.add(parameter(params.get(i), i));
        }
        return result;
    }

    /**
     * Describes one parameter.
     *
     * @param node parameter node
     * @param position 0-indexed position
     * @return parameter record
     */
    public static ParameterInfo parameter(SyntaxNode node, int position) {
        return switch (node.tag()) {
            case VARIABLE -> new ParameterInfo(position, node.name(), ParameterKind.SIMPLE, null, node);
            case PIN -> new ParameterInfo(position, pinnedName(node), ParameterKind.PIN, null, node);
            case OPERATOR -> "\\\\".equals(node.name()) && node.children().size() == 2
                ? new ParameterInfo(position, variableName(node.children().get(0)), ParameterKind.DEFAULT,
                    SyntaxNodes.render(node.children().get(1)), node)
                : new ParameterInfo(position, null, ParameterKind.PATTERN, null, node);
            case MATCH -> new ParameterInfo(position, matchName(node), ParameterKind.PATTERN, null, node);
            default -> new ParameterInfo(position, null, ParameterKind.PATTERN, null, node);
        };
    }

    /**
     * Counts parameters carrying a default value.
     *
     * @param params parameter nodes
     * @return number of {@code \\} parameters
     */
    public static int defaultCount(List<SyntaxNode> params) {
        return (int) params.stream()
            .filter(p -> p.is(NodeTag.OPERATOR) && "\\\\".equals(p.name()))
            .count();
    }

    public static Set<String> boundVariables(SyntaxNode pattern) {
        return Bindings.boundBy(pattern);
    }

    private static String variableName(SyntaxNode node) {
        return node.is(NodeTag.VARIABLE) ? node.name() : null;
    }

    private static String pinnedName(SyntaxNode pin) {
        return pin.children().isEmpty() ? null : variableName(pin.children().get(0));
    }

    // `%User{} = user` and `user = %User{}` both name the parameter `user`
    private static String matchName(SyntaxNode match) {
        for (SyntaxNode side : match.children()) {
            if (side.is(NodeTag.VARIABLE)) {
                return side.name();
            }
        }
        return null;
    }
}
