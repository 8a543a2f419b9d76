package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * {@code alias Source} or {@code alias Source, as: Short}.
 *
 * @param source aliased module segments
 * @param as short name, the last source segment unless given explicitly
 * @param explicitAs true when {@code as:} was written
 * @param location source lines, or null
 * @param scope active scope
 */
public record AliasDirective(
    List<String> source,
    String as,
    boolean explicitAs,
    SourceLocation location,
    Scope scope
) implements Directive {

    public AliasDirective {
        source = requireSegments(source);
        if (as == null) {
            as = source.get(source.size() - 1);
        }
        if (scope == null) {
            scope = Scope.MODULE;
        }
    }

    static List<String> requireSegments(List<String> source) {
        Objects.requireNonNull(source, "source must not be null");
        if (source.isEmpty()) {
            throw new IllegalArgumentException("source must have at least one segment");
        }
        return List.copyOf(source);
    }

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.ALIAS;
    }

    @Override
    public AliasDirective withScope(Scope newScope) {
        return new AliasDirective(source, as, explicitAs, location, newScope);
    }
}
