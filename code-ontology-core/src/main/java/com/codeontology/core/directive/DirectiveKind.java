package com.codeontology.core.directive;

import com.codeontology.core.ast.NodeTag;

import java.util.Optional;

/**
 * The four lexical directives.
 */
public enum DirectiveKind {
    ALIAS(NodeTag.ALIAS),
    IMPORT(NodeTag.IMPORT),
    REQUIRE(NodeTag.REQUIRE),
    USE(NodeTag.USE);

    private final NodeTag tag;

    DirectiveKind(NodeTag tag) {
        this.tag = tag;
    }

    public NodeTag tag() {
        return tag;
    }

    public static Optional<DirectiveKind> fromTag(NodeTag tag) {
        for (DirectiveKind kind : values()) {
            if (kind.tag == tag) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
