package com.codeontology.core.directive;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for extracting directives from single nodes.
 *
 * <pre>{@code
 * DirectiveExtractor extractor = new DirectiveExtractor();
 * DirectiveResult<List<Directive>> result = extractor.extractAll(aliasNode);
 * if (result.isOk()) {
 *     result.value().forEach(d -> System.out.println(d.sourceName()));
 * }
 * }</pre>
 */
public class DirectiveExtractor {

    /** Default bound for multi-target nesting. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 10;

    private final Map<DirectiveKind, AbstractDirectiveExtractor<?>> extractors;
    private final MultiTargetExpander expander;

    public DirectiveExtractor() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    public DirectiveExtractor(int maxNestingDepth) {
        this.extractors = MultiTargetExpander.defaultExtractors();
        this.expander = new MultiTargetExpander(maxNestingDepth, extractors);
    }

    public boolean isDirective(SyntaxNode node) {
        return node != null && node.tag().isDirective();
    }

    /**
     * Returns true if the directive's module operand is a multi-target group.
     *
     * @param node directive node
     * @return whether the node needs expansion
     */
    public boolean isMultiTarget(SyntaxNode node) {
        return isDirective(node)
            && AbstractDirectiveExtractor.target(node).map(t -> t.is(NodeTag.MULTI_ALIAS)).orElse(false);
    }

    /**
     * Extracts one single-target directive.
     *
     * @param node directive node
     * @return the directive, or a {@code NOT_A_DIRECTIVE} error
     */
    public DirectiveResult<Directive> extract(SyntaxNode node) {
        Optional<DirectiveKind> kind = node == null ? Optional.empty() : DirectiveKind.fromTag(node.tag());
        if (kind.isEmpty()) {
            return DirectiveResult.notADirective(
                "Not a directive: " + AbstractDirectiveExtractor.describe(node),
                node == null ? null : node.location());
        }
        return extractors.get(kind.get()).extract(node).map(d -> (Directive) d);
    }

    /**
     * Extracts all directives of a node, expanding multi-target groups.
     *
     * @param node directive node
     * @return directives in source order, or an error value
     */
    public DirectiveResult<List<Directive>> extractAll(SyntaxNode node) {
        if (isMultiTarget(node)) {
            return expander.expand(DirectiveKind.fromTag(node.tag()).orElseThrow(), node);
        }
        return extract(node).map(directive -> List.of(directive));
    }
}
