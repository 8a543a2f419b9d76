package com.codeontology.core.directive;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts {@code use} directives and their options.
 *
 * <p>Keyword children become keyed options. Further positional operands become positional
 * options, except a {@code LIST} of keywords, which is unpacked. Values that are not built
 * from literals and module names are flagged dynamic.
 */
public class UseExtractor extends AbstractDirectiveExtractor<UseDirective> {

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.USE;
    }

    @Override
    protected DirectiveResult<UseDirective> build(List<String> source, SyntaxNode node, SourceLocation location) {
        return DirectiveResult.ok(new UseDirective(source, options(node), location, Scope.MODULE));
    }

    @Override
    protected UseDirective expanded(List<String> source, SyntaxNode group, SourceLocation location) {
        return new UseDirective(source, options(group), location, Scope.MODULE);
    }

    private static List<UseOption> options(SyntaxNode node) {
        List<UseOption> options = new ArrayList<>();
        List<SyntaxNode> positional = node.positional();
        for (int i = 1; i < positional.size(); i++) {
            SyntaxNode argument = positional.get(i);
            if (argument.is(NodeTag.LIST) && !argument.children().isEmpty()
                && argument.children().stream().allMatch(child -> child.is(NodeTag.KEYWORD))) {
                argument.children().forEach(keyword -> options.add(keyed(keyword)));
            } else {
                options.add(new UseOption(null, SyntaxNodes.render(argument), !isStatic(argument)));
            }
        }
        for (SyntaxNode keyword : node.keywords()) {
            options.add(keyed(keyword));
        }
        return options;
    }

    private static UseOption keyed(SyntaxNode keyword) {
        List<SyntaxNode> values = keyword.children();
        SyntaxNode value = values.size() == 1 ? values.get(0) : SyntaxNodes.node(NodeTag.LIST, values.toArray(SyntaxNode[]::new));
        return new UseOption(keyword.name(), SyntaxNodes.render(value), !isStatic(value));
    }

    /**
     * Returns true if the value is known at compile time.
     *
     * @param value option value
     * @return true for literals, module names and collections of those
     */
    static boolean isStatic(SyntaxNode value) {
        if (value.tag().isLiteral() || value.is(NodeTag.MODULE_NAME)) {
            return true;
        }
        return switch (value.tag()) {
            case LIST, TUPLE, MAP, KEYWORD -> value.children().stream().allMatch(UseExtractor::isStatic);
            default -> false;
        };
    }
}
