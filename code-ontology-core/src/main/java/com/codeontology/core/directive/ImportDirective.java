package com.codeontology.core.directive;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;

/**
 * {@code import Source} with optional {@code only:} / {@code except:} selectors.
 *
 * @param source imported module segments
 * @param only {@code only:} selector, or null
 * @param except {@code except:} selector, or null
 * @param location source lines, or null
 * @param scope active scope
 */
public record ImportDirective(
    List<String> source,
    ImportSelector only,
    ImportSelector except,
    SourceLocation location,
    Scope scope
) implements Directive {

    public ImportDirective {
        source = AliasDirective.requireSegments(source);
        if (scope == null) {
            scope = Scope.MODULE;
        }
    }

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.IMPORT;
    }

    @Override
    public ImportDirective withScope(Scope newScope) {
        return new ImportDirective(source, only, except, location, newScope);
    }

    public boolean isFullImport() {
        return only == null && except == null;
    }
}
