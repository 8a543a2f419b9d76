package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;

import java.util.List;
import java.util.Optional;

/**
 * Extracts {@code require} directives.
 */
public class RequireExtractor extends AbstractDirectiveExtractor<RequireDirective> {

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.REQUIRE;
    }

    @Override
    protected DirectiveResult<RequireDirective> build(List<String> source, SyntaxNode node, SourceLocation location) {
        Optional<SyntaxNode> as = node.keywordValue("as");
        if (as.isEmpty()) {
            return DirectiveResult.ok(new RequireDirective(source, null, location, Scope.MODULE));
        }
        Optional<String> alias = SyntaxNodes.moduleNameOf(as.get());
        if (alias.isEmpty()) {
            return DirectiveResult.notADirective("Invalid as: option " + SyntaxNodes.render(as.get()), location);
        }
        return DirectiveResult.ok(new RequireDirective(source, alias.get(), location, Scope.MODULE));
    }

    @Override
    protected RequireDirective expanded(List<String> source, SyntaxNode group, SourceLocation location) {
        return new RequireDirective(source, null, location, Scope.MODULE);
    }
}
