package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A named function, macro, guard or delegate with all of its clauses.
 *
 * <p>Consecutive definitions with the same name and arity are one function.
 *
 * @param module defining module
 * @param name function name
 * @param arity maximum arity
 * @param minArity arity without defaulted parameters
 * @param form definition form
 * @param visibility public or private
 * @param docstring {@code @doc} text, or null
 * @param docFalse true when {@code @doc false} precedes the definition
 * @param delegate delegate target for {@code defdelegate}, or null
 * @param clauses clauses in source order
 * @param location lines of the first clause, or null
 */
public record FunctionInfo(
    String module,
    String name,
    int arity,
    int minArity,
    FunctionForm form,
    Visibility visibility,
    String docstring,
    boolean docFalse,
    DelegateTarget delegate,
    List<ClauseInfo> clauses,
    SourceLocation location
) {
    public FunctionInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(form, "form must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        if (arity < 0 || minArity < 0 || minArity > arity) {
            throw new IllegalArgumentException(
                "invalid arity range " + minArity + ".." + arity + " for " + name);
        }
        clauses = clauses != null ? List.copyOf(clauses) : List.of();
    }

    public FunctionSignature signature() {
        return new FunctionSignature(name, arity);
    }

    public boolean isMacro() {
        return form == FunctionForm.MACRO;
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }
}
