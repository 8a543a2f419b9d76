package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;

/**
 * {@code require Source} or {@code require Source, as: Short}.
 *
 * @param source required module segments
 * @param as alias set by {@code as:}, or null
 * @param location source lines, or null
 * @param scope active scope
 */
public record RequireDirective(
    List<String> source,
    String as,
    SourceLocation location,
    Scope scope
) implements Directive {

    public RequireDirective {
        source = AliasDirective.requireSegments(source);
        if (scope == null) {
            scope = Scope.MODULE;
        }
    }

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.REQUIRE;
    }

    @Override
    public RequireDirective withScope(Scope newScope) {
        return new RequireDirective(source, as, location, newScope);
    }
}
