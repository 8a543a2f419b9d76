package com.codeontology.core.directive;

import java.util.List;

/**
 * Directives found by a scope-tracking traversal together with the per-node failures the
 * best-effort path skips.
 *
 * @param directives extracted directives in traversal order
 * @param errors failures in traversal order
 */
public record DirectiveScan(List<Directive> directives, List<DirectiveError> errors) {

    public DirectiveScan {
        directives = directives != null ? List.copyOf(directives) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
