package com.codeontology.core.directive;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Expands multi-target directives such as {@code alias MyApp.{Accounts, Billing.{Invoice}}}.
 *
 * <p>Each simple target yields one directive whose source is the accumulated prefix followed by
 * the target's segments. A nested group is expanded recursively with its own prefix appended
 * and the depth increased by one. The outermost group has depth 1; the depth is checked before
 * a group's targets are visited. Exceeding the maximum aborts the whole expansion: the result is
 * a {@code MAX_NESTING_DEPTH_EXCEEDED} error and no directive of the group is returned.
 *
 * <p>Output is pre-order: a nested group's directives take the position the group occupies
 * among its siblings.
 */
public class MultiTargetExpander {

    private static final Logger log = LoggerFactory.getLogger(MultiTargetExpander.class);

    private final int maxDepth;
    private final Map<DirectiveKind, AbstractDirectiveExtractor<?>> extractors;

    public MultiTargetExpander(int maxDepth) {
        this(maxDepth, defaultExtractors());
    }

    MultiTargetExpander(int maxDepth, Map<DirectiveKind, AbstractDirectiveExtractor<?>> extractors) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.extractors = Objects.requireNonNull(extractors, "extractors must not be null");
    }

    static Map<DirectiveKind, AbstractDirectiveExtractor<?>> defaultExtractors() {
        Map<DirectiveKind, AbstractDirectiveExtractor<?>> map = new EnumMap<>(DirectiveKind.class);
        map.put(DirectiveKind.ALIAS, new AliasExtractor());
        map.put(DirectiveKind.IMPORT, new ImportExtractor());
        map.put(DirectiveKind.REQUIRE, new RequireExtractor());
        map.put(DirectiveKind.USE, new UseExtractor());
        return map;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Expands a directive node whose module operand is a {@code MULTI_ALIAS} group.
     *
     * @param kind directive kind
     * @param node directive node
     * @return directives in pre-order, or an error value
     */
    public DirectiveResult<List<Directive>> expand(DirectiveKind kind, SyntaxNode node) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (node == null || !node.is(kind.tag())) {
            return DirectiveResult.notADirective("Not a " + kind + " directive", node == null ? null : node.location());
        }
        Optional<SyntaxNode> group = AbstractDirectiveExtractor.target(node);
        if (group.isEmpty() || !group.get().is(NodeTag.MULTI_ALIAS)) {
            return DirectiveResult.notADirective("Not a multi-target directive", node.location());
        }

        AbstractDirectiveExtractor<?> extractor = extractors.get(kind);
        List<Directive> out = new ArrayList<>();
        try {
            expandGroup(extractor, node, group.get(), List.of(), 1, out);
        } catch (MaxNestingDepthExceededException e) {
            log.warn("Multi-target {} at {} not expanded: {}", kind, node.location(), e.getMessage());
            return DirectiveResult.error(new DirectiveError(
                DirectiveError.Kind.MAX_NESTING_DEPTH_EXCEEDED, e.getMessage(), node.location()));
        } catch (MalformedGroupException e) {
            return DirectiveResult.notADirective(e.getMessage(), node.location());
        }
        return DirectiveResult.ok(List.copyOf(out));
    }

    private void expandGroup(AbstractDirectiveExtractor<?> extractor, SyntaxNode directive, SyntaxNode group,
                             List<String> outerPrefix, int depth, List<Directive> out)
        throws MaxNestingDepthExceededException, MalformedGroupException {
        if (depth > maxDepth) {
            throw new MaxNestingDepthExceededException(depth, maxDepth);
        }
        List<SyntaxNode> parts = group.children();
        if (parts.isEmpty()) {
            throw new MalformedGroupException("Multi-target group without prefix");
        }
        List<String> prefix = concat(outerPrefix, segmentsOf(parts.get(0)));
        SourceLocation groupLocation = group.location() != null ? group.location() : directive.location();

        for (SyntaxNode target : parts.subList(1, parts.size())) {
            if (target.is(NodeTag.MULTI_ALIAS)) {
                expandGroup(extractor, directive, target, prefix, depth + 1, out);
            } else {
                SourceLocation location = target.location() != null ? target.location() : groupLocation;
                out.add(extractor.expanded(concat(prefix, segmentsOf(target)), directive, location));
            }
        }
    }

    private static List<String> segmentsOf(SyntaxNode node) throws MalformedGroupException {
        Optional<List<String>> segments = SyntaxNodes.segments(node);
        if (segments.isEmpty()) {
            throw new MalformedGroupException("Invalid multi-target element: " + SyntaxNodes.render(node));
        }
        return segments.get();
    }

    private static List<String> concat(List<String> left, List<String> right) {
        List<String> joined = new ArrayList<>(left.size() + right.size());
        joined.addAll(left);
        joined.addAll(right);
        return joined;
    }

    private static final class MalformedGroupException extends Exception {
        MalformedGroupException(String message) {
            super(message);
        }
    }
}
