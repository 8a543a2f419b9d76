package com.codeontology.core.ast;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Closed set of node shapes the extraction pipeline understands.
 *
 * <p>Every tag belongs to a {@link Category}. Consumers switch over the tag and fall back to
 * {@link #UNRECOGNIZED} explicitly instead of relying on fall-through; tags that a JSON
 * producer emits but this enum does not know are deserialized as {@code UNRECOGNIZED}.
 *
 * @since 1.0.0
 */
public enum NodeTag {

    /** {@code defmodule Name do ... end}; children: module name, {@code do} keyword. */
    MODULE_DEF(Category.DEFINITION),
    /** {@code def}/{@code defp}/{@code defmacro}/... ; name is the function name, value the form. */
    FUNCTION_DEF(Category.DEFINITION),
    /** {@code defstruct}; children are field atoms or keyword defaults. */
    DEFSTRUCT(Category.DEFINITION),
    /** {@code defexception}; same shape as {@link #DEFSTRUCT}. */
    DEFEXCEPTION(Category.DEFINITION),
    /** {@code defprotocol Name do ... end}. */
    DEFPROTOCOL(Category.DEFINITION),
    /** {@code defimpl Protocol, for: Type do ... end}. */
    DEFIMPL(Category.DEFINITION),

    /** {@code alias}. */
    ALIAS(Category.DIRECTIVE),
    /** {@code import}. */
    IMPORT(Category.DIRECTIVE),
    /** {@code require}. */
    REQUIRE(Category.DIRECTIVE),
    /** {@code use}. */
    USE(Category.DIRECTIVE),
    /** {@code Prefix.{A, B}} group; first child is the prefix, the rest are targets. */
    MULTI_ALIAS(Category.OTHER),
    /** Dotted module reference; {@code name} holds the dotted path. */
    MODULE_NAME(Category.OTHER),

    /** {@code if}. */
    IF(Category.BLOCK_CONSTRUCT),
    /** {@code unless}. */
    UNLESS(Category.BLOCK_CONSTRUCT),
    /** {@code case}. */
    CASE(Category.BLOCK_CONSTRUCT),
    /** {@code cond}. */
    COND(Category.BLOCK_CONSTRUCT),
    /** {@code with}. */
    WITH(Category.BLOCK_CONSTRUCT),
    /** {@code for} comprehension. */
    FOR(Category.BLOCK_CONSTRUCT),
    /** {@code try}. */
    TRY(Category.BLOCK_CONSTRUCT),
    /** {@code receive}. */
    RECEIVE(Category.BLOCK_CONSTRUCT),

    /** {@code fn ... end}; children are {@link #CLAUSE} nodes. */
    ANONYMOUS_FUNCTION(Category.OTHER),
    /**
     * {@code &expr}; one child. {@code &name/arity} and {@code &Mod.name/arity} hold a {@code /}
     * operator, a shorthand such as {@code &(&1 + 1)} holds its body, and a placeholder
     * {@code &1} holds a positive integer.
     */
    CAPTURE(Category.OTHER),
    /** {@code pattern -> body}; labelled {@code params}, {@code when}, {@code do}. */
    CLAUSE(Category.OTHER),
    /** Statement sequence. */
    BLOCK(Category.OTHER),

    /** {@code name(args)}. */
    LOCAL_CALL(Category.CALL),
    /** {@code Module.name(args)}; first child is the receiver. */
    REMOTE_CALL(Category.CALL),
    /** {@code fun.(args)}; first child is the callee expression. */
    DYNAMIC_CALL(Category.CALL),
    /** Unary or binary operator; {@code name} is the symbol. */
    OPERATOR(Category.CALL),

    /** Atom literal. */
    ATOM(Category.LITERAL),
    /** Integer literal. */
    INTEGER(Category.LITERAL),
    /** Float literal. */
    FLOAT(Category.LITERAL),
    /** Binary string literal. */
    STRING(Category.LITERAL),
    /** Boolean literal. */
    BOOLEAN(Category.LITERAL),
    /** {@code nil}. */
    NIL(Category.LITERAL),
    /** Charlist literal. */
    CHARLIST(Category.LITERAL),

    /** List. */
    LIST(Category.COLLECTION),
    /** Tuple. */
    TUPLE(Category.COLLECTION),
    /** Map. */
    MAP(Category.COLLECTION),
    /** Labelled operand or keyword pair; {@code name} is the label. */
    KEYWORD(Category.COLLECTION),

    /** Variable reference or binding. */
    VARIABLE(Category.PATTERN),
    /** {@code _}. */
    WILDCARD(Category.PATTERN),
    /** {@code ^var}. */
    PIN(Category.PATTERN),
    /** {@code left = right}. */
    MATCH(Category.PATTERN),
    /** {@code %Name{...}}. */
    STRUCT(Category.PATTERN),

    /** {@code @name value} or {@code @name}. */
    ATTRIBUTE(Category.META),
    /** {@code quote do ... end}. */
    QUOTE(Category.META),
    /** {@code unquote(expr)}. */
    UNQUOTE(Category.META),
    /** {@code unquote_splicing(expr)}. */
    UNQUOTE_SPLICING(Category.META),

    /** Shape not known to the pipeline. */
    @JsonEnumDefaultValue
    UNRECOGNIZED(Category.OTHER);

    /**
     * Coarse grouping of tags.
     */
    public enum Category {
        /** Module, function, struct and protocol definitions */
        DEFINITION,
        /** alias/import/require/use */
        DIRECTIVE,
        /** Constructs opening a lexical block */
        BLOCK_CONSTRUCT,
        /** Calls and operators */
        CALL,
        /** Scalar literals */
        LITERAL,
        /** Lists, tuples, maps, keywords */
        COLLECTION,
        /** Variables and pattern-only forms */
        PATTERN,
        /** Attributes and metaprogramming */
        META,
        /** Everything else */
        OTHER
    }

    private final Category category;

    NodeTag(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean isDirective() {
        return category == Category.DIRECTIVE;
    }

    public boolean isBlockConstruct() {
        return category == Category.BLOCK_CONSTRUCT;
    }

    public boolean isLiteral() {
        return category == Category.LITERAL;
    }

    /**
     * Returns true for tags that open a new module-like unit.
     *
     * @return true for module, protocol and implementation definitions
     */
    public boolean isModuleLike() {
        return this == MODULE_DEF || this == DEFPROTOCOL || this == DEFIMPL;
    }
}
