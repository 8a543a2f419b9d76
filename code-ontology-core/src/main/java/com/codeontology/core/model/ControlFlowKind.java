package com.codeontology.core.model;

import com.codeontology.core.ast.NodeTag;

import java.util.Optional;

/**
 * Control-flow and exception expression kinds.
 */
public enum ControlFlowKind {
    IF("if"),
    UNLESS("unless"),
    COND("cond"),
    CASE("case"),
    WITH("with"),
    RECEIVE("receive"),
    FOR("for"),
    TRY("try"),
    RAISE("raise"),
    THROW("throw"),
    EXIT("exit");

    private final String keyword;

    ControlFlowKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the Elixir keyword, also used as the IRI path segment.
     *
     * @return keyword such as {@code "case"}
     */
    public String keyword() {
        return keyword;
    }

    /**
     * True for {@code try}, {@code raise}, {@code throw} and {@code exit}.
     *
     * @return whether the expression is exception handling
     */
    public boolean isExceptionRelated() {
        return this == TRY || this == RAISE || this == THROW || this == EXIT;
    }

    public static Optional<ControlFlowKind> fromTag(NodeTag tag) {
        return switch (tag) {
            case IF -> Optional.of(IF);
            case UNLESS -> Optional.of(UNLESS);
            case COND -> Optional.of(COND);
            case CASE -> Optional.of(CASE);
            case WITH -> Optional.of(WITH);
            case RECEIVE -> Optional.of(RECEIVE);
            case FOR -> Optional.of(FOR);
            case TRY -> Optional.of(TRY);
            default -> Optional.empty();
        };
    }

    /**
     * Maps a local call name to an exception expression kind.
     *
     * @param callName local call name
     * @return {@code RAISE}, {@code THROW} or {@code EXIT} for {@code raise}/{@code reraise},
     *         {@code throw} and {@code exit}
     */
    public static Optional<ControlFlowKind> fromCall(String callName) {
        if (callName == null) {
            return Optional.empty();
        }
        return switch (callName) {
            case "raise", "reraise" -> Optional.of(RAISE);
            case "throw" -> Optional.of(THROW);
            case "exit" -> Optional.of(EXIT);
            default -> Optional.empty();
        };
    }
}
