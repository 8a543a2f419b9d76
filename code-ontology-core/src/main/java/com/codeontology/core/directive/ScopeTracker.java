package com.codeontology.core.directive;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects directives from statement lists, tagging each with the lexical scope it occurs in.
 *
 * <p>Traversal is pre-order, left to right:
 * <ul>
 *   <li>function definitions switch to {@link Scope#FUNCTION}</li>
 *   <li>block constructs switch to {@link Scope#BLOCK}, except at module level where they stay
 *       {@link Scope#MODULE}</li>
 *   <li>directive nodes are extracted (multi-target groups expanded)</li>
 *   <li>nested module definitions are not entered; they are traversed as their own unit</li>
 *   <li>every other node is traversed with the scope unchanged</li>
 * </ul>
 *
 * <p>{@link #extractWithScope} is best-effort: directives that fail to extract are logged and
 * skipped. {@link #scan} returns the failures alongside the directives.
 */
public class ScopeTracker {

    private static final Logger log = LoggerFactory.getLogger(ScopeTracker.class);

    private final DirectiveExtractor extractor;

    public ScopeTracker() {
        this(new DirectiveExtractor());
    }

    public ScopeTracker(DirectiveExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    public List<Directive> extractWithScope(List<SyntaxNode> statements) {
        return extractWithScope(statements, Scope.MODULE);
    }

    /**
     * Collects directives, skipping failures.
     *
     * @param statements statements in source order
     * @param startScope scope of the statements themselves
     * @return directives in traversal order
     */
    public List<Directive> extractWithScope(List<SyntaxNode> statements, Scope startScope) {
        return scan(statements, startScope).directives();
    }

    public DirectiveScan scan(List<SyntaxNode> statements) {
        return scan(statements, Scope.MODULE);
    }

    /**
     * Collects directives and extraction failures.
     *
     * @param statements statements in source order
     * @param startScope scope of the statements themselves
     * @return directives and failures, both in traversal order
     */
    public DirectiveScan scan(List<SyntaxNode> statements, Scope startScope) {
        Objects.requireNonNull(statements, "statements must not be null");
        Objects.requireNonNull(startScope, "startScope must not be null");
        List<Directive> directives = new ArrayList<>();
        List<DirectiveError> errors = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            traverse(statement, startScope, directives, errors);
        }
        return new DirectiveScan(directives, errors);
    }

    private void traverse(SyntaxNode node, Scope scope, List<Directive> directives, List<DirectiveError> errors) {
        if (node == null) {
            return;
        }
        if (node.tag().isDirective()) {
            DirectiveResult<List<Directive>> result = extractor.extractAll(node);
            if (result.isOk()) {
                result.value().forEach(directive -> directives.add(directive.withScope(scope)));
            } else {
                log.debug("Skipping directive at {}: {}", node.location(), result.error().message());
                errors.add(result.error());
            }
            return;
        }
        if (node.tag().isModuleLike()) {
            return;
        }
        Scope inner = scope;
        if (node.is(NodeTag.FUNCTION_DEF)) {
            inner = Scope.FUNCTION;
        } else if (node.tag().isBlockConstruct()) {
            inner = scope == Scope.MODULE ? Scope.MODULE : Scope.BLOCK;
        }
        for (SyntaxNode child : node.children()) {
            traverse(child, inner, directives, errors);
        }
    }
}
