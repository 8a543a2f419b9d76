package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;

/**
 * A lexical directive bringing another module's names into scope.
 *
 * <p>Implementations are immutable records: {@link AliasDirective}, {@link ImportDirective},
 * {@link RequireDirective} and {@link UseDirective}. Every directive produced by
 * {@link ScopeTracker} carries the scope active where it was found; directives extracted in
 * isolation default to {@link Scope#MODULE}.
 */
public interface Directive {

    DirectiveKind kind();

    /**
     * Returns the referenced module as ordered name segments.
     *
     * @return segments such as {@code [MyApp, Accounts, User]}
     */
    List<String> source();

    SourceLocation location();

    Scope scope();

    /**
     * Returns a copy tagged with another scope.
     *
     * @param newScope scope to apply
     * @return re-scoped directive
     */
    Directive withScope(Scope newScope);

    /**
     * Returns the referenced module as a dotted name.
     *
     * @return name such as {@code MyApp.Accounts.User}
     */
    default String sourceName() {
        return String.join(".", source());
    }
}
