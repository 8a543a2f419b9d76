package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Optional;

/**
 * {@code use Source, options}.
 *
 * @param source used module segments
 * @param options options in source order
 * @param location source lines, or null
 * @param scope active scope
 */
public record UseDirective(
    List<String> source,
    List<UseOption> options,
    SourceLocation location,
    Scope scope
) implements Directive {

    public UseDirective {
        source = AliasDirective.requireSegments(source);
        options = options != null ? List.copyOf(options) : List.of();
        if (scope == null) {
            scope = Scope.MODULE;
        }
    }

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.USE;
    }

    @Override
    public UseDirective withScope(Scope newScope) {
        return new UseDirective(source, options, location, newScope);
    }

    public Optional<UseOption> option(String key) {
        return options.stream().filter(option -> key.equals(option.key())).findFirst();
    }
}
