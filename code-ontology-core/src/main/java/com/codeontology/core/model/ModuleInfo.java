package com.codeontology.core.model;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.directive.Directive;

import java.util.List;
import java.util.Objects;

/**
 * Module-level facts of one {@code defmodule}.
 *
 * @param name fully qualified module name
 * @param docstring {@code @moduledoc} text, or null
 * @param docFalse true for {@code @moduledoc false}
 * @param parentModule enclosing module for nested definitions, or null
 * @param nestedModules fully qualified names of directly nested modules
 * @param directives directives of the module body, scope-tagged, in traversal order
 * @param functions public and private functions
 * @param macros macros
 * @param types type definitions
 * @param location source lines, or null
 */
public record ModuleInfo(
    String name,
    String docstring,
    boolean docFalse,
    String parentModule,
    List<String> nestedModules,
    List<Directive> directives,
    List<FunctionSignature> functions,
    List<FunctionSignature> macros,
    List<FunctionSignature> types,
    SourceLocation location
) {
    public ModuleInfo {
        Objects.requireNonNull(name, "name must not be null");
        nestedModules = nestedModules != null ? List.copyOf(nestedModules) : List.of();
        directives = directives != null ? List.copyOf(directives) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
        macros = macros != null ? List.copyOf(macros) : List.of();
        types = types != null ? List.copyOf(types) : List.of();
    }

    public static ModuleInfo named(String name) {
        return new ModuleInfo(name, null, false, null, List.of(), List.of(), List.of(), List.of(), List.of(), null);
    }

    public boolean isNested() {
        return parentModule != null;
    }
}
