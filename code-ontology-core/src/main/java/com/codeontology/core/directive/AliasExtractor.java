package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;

import java.util.List;
import java.util.Optional;

/**
 * Extracts {@code alias} directives.
 */
public class AliasExtractor extends AbstractDirectiveExtractor<AliasDirective> {

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.ALIAS;
    }

    @Override
    protected DirectiveResult<AliasDirective> build(List<String> source, SyntaxNode node, SourceLocation location) {
        Optional<SyntaxNode> as = node.keywordValue("as");
        if (as.isEmpty()) {
            return DirectiveResult.ok(new AliasDirective(source, null, false, location, Scope.MODULE));
        }
        Optional<String> shortName = SyntaxNodes.moduleNameOf(as.get());
        if (shortName.isEmpty()) {
            return DirectiveResult.notADirective("Invalid as: option " + SyntaxNodes.render(as.get()), location);
        }
        return DirectiveResult.ok(new AliasDirective(source, shortName.get(), true, location, Scope.MODULE));
    }

    @Override
    protected AliasDirective expanded(List<String> source, SyntaxNode group, SourceLocation location) {
        return new AliasDirective(source, null, false, location, Scope.MODULE);
    }
}
