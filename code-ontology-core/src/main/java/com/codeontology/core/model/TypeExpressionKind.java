package com.codeontology.core.model;

/**
 * Shape of a type expression.
 */
public enum TypeExpressionKind {
    /** Built-in type such as {@code integer()} or {@code any}. */
    BASIC,
    /** {@code a | b}. */
    UNION,
    /** {@code {a, b}}. */
    TUPLE,
    /** {@code [a]} or {@code list(a)}. */
    LIST,
    /** {@code %{k => v}}. */
    MAP,
    /** {@code (a -> b)}. */
    FUNCTION,
    /** Type variable bound by a parameterised type or a {@code when} clause. */
    VARIABLE,
    /** Local type applied to arguments, such as {@code keyword(value)}. */
    PARAMETERIZED,
    /** Type from another module, such as {@code String.t()}. */
    REMOTE,
    /** Literal atom, integer or range. */
    LITERAL
}
