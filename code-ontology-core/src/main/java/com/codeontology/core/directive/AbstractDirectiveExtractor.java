package com.codeontology.core.directive;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Shared shape handling for the per-kind directive extractors.
 *
 * <p>A directive node has the referenced module as its first positional child and labelled
 * options as keyword children. Subclasses only interpret the options.
 *
 * @param <D> directive type produced
 */
public abstract class AbstractDirectiveExtractor<D extends Directive> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    /**
     * Returns the directive kind this extractor handles.
     *
     * @return directive kind
     */
    public abstract DirectiveKind kind();

    /**
     * Extracts a single-target directive.
     *
     * @param node directive node
     * @return the directive, or a {@code NOT_A_DIRECTIVE} error for any other shape,
     *         including multi-target groups
     */
    public DirectiveResult<D> extract(SyntaxNode node) {
        if (node == null || !node.is(kind().tag())) {
            return DirectiveResult.notADirective(
                "Not " + kind().name().toLowerCase(Locale.ROOT) + " directive: " + describe(node),
                node == null ? null : node.location());
        }
        Optional<SyntaxNode> target = target(node);
        if (target.isEmpty()) {
            return DirectiveResult.notADirective("Directive without module: " + describe(node), node.location());
        }
        if (target.get().is(NodeTag.MULTI_ALIAS)) {
            return DirectiveResult.notADirective("Multi-target directive needs expansion", node.location());
        }
        Optional<List<String>> source = sourceSegments(target.get());
        if (source.isEmpty()) {
            return DirectiveResult.notADirective(
                "Unsupported module reference: " + SyntaxNodes.render(target.get()), node.location());
        }
        return build(source.get(), node, node.location());
    }

    /**
     * Interprets the options of {@code node} for a directive on {@code source}.
     *
     * @param source module segments
     * @param node the directive node
     * @param location source lines
     * @return the directive, or an error for invalid options
     */
    protected abstract DirectiveResult<D> build(List<String> source, SyntaxNode node, SourceLocation location);

    /**
     * Creates the directive for one target of an expanded multi-target group.
     *
     * <p>Options that name a single module ({@code as:}) do not apply to expanded targets.
     *
     * @param source full module segments of the target
     * @param group the original directive node
     * @param location lines of the target, or of the group when unknown
     * @return the directive
     */
    protected abstract D expanded(List<String> source, SyntaxNode group, SourceLocation location);

    /**
     * Returns the first positional operand of a directive node.
     *
     * @param node directive node
     * @return module reference or multi-target group
     */
    static Optional<SyntaxNode> target(SyntaxNode node) {
        List<SyntaxNode> positional = node.positional();
        return positional.isEmpty() ? Optional.empty() : Optional.of(positional.get(0));
    }

    /**
     * Resolves a module reference into name segments.
     *
     * <p>Elixir modules split on dots; Erlang modules ({@code :ets}) and {@code __MODULE__}
     * are single segments.
     *
     * @param reference module reference node
     * @return segments, or empty for unsupported shapes
     */
    static Optional<List<String>> sourceSegments(SyntaxNode reference) {
        return switch (reference.tag()) {
            case MODULE_NAME -> SyntaxNodes.segments(reference);
            case ATOM -> SyntaxNodes.moduleNameOf(reference).map(List::of);
            case VARIABLE -> "__MODULE__".equals(reference.name())
                ? Optional.of(List.of("__MODULE__"))
                : Optional.empty();
            default -> Optional.empty();
        };
    }

    static String describe(SyntaxNode node) {
        return node == null ? "null" : node.tag() + (node.name() != null ? " " + node.name() : "");
    }
}
