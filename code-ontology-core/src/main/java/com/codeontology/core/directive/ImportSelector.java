package com.codeontology.core.directive;

import java.util.List;
import java.util.Set;

/**
 * An {@code only:} or {@code except:} restriction of an import.
 *
 * <p>Either an explicit function list or one of the categories {@code functions},
 * {@code macros} or {@code sigils}.
 *
 * @param functions explicit {@code name/arity} entries, empty for a category selector
 * @param category category name, or null for an explicit list
 */
public record ImportSelector(List<ImportedFunction> functions, String category) {

    /** Categories accepted by {@code import ..., only: :category}. */
    public static final Set<String> CATEGORIES = Set.of("functions", "macros", "sigils");

    public ImportSelector {
        functions = functions != null ? List.copyOf(functions) : List.of();
        if (category != null && !CATEGORIES.contains(category)) {
            throw new IllegalArgumentException("Unknown import category: " + category);
        }
        if (category != null && !functions.isEmpty()) {
            throw new IllegalArgumentException("A selector is either a category or a function list");
        }
    }

    public static ImportSelector of(List<ImportedFunction> functions) {
        return new ImportSelector(functions, null);
    }

    public static ImportSelector category(String category) {
        return new ImportSelector(List.of(), category);
    }

    public boolean isCategory() {
        return category != null;
    }

    /**
     * Renders the selector as written, e.g. {@code [get: 1, put: 2]} or {@code :macros}.
     *
     * @return rendered selector
     */
    public String render() {
        if (isCategory()) {
            return ":" + category;
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < functions.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(functions.get(i).name()).append(": ").append(functions.get(i).arity());
        }
        return sb.append(']').toString();
    }
}
