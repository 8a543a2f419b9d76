package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;

import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal of a module body that stays inside the module.
 *
 * <p>Nested {@code defmodule}, {@code defprotocol} and {@code defimpl} nodes are separate units
 * and are never entered. Quoted code is entered only on request.
 */
final class BodyWalker {

    private BodyWalker() {
        // Utility class - no instantiation
    }

    static void walk(List<SyntaxNode> statements, boolean enterQuotes, Consumer<SyntaxNode> visitor) {
        for (SyntaxNode statement : statements) {
            walk(statement, enterQuotes, visitor);
        }
    }

    static void walk(SyntaxNode node, boolean enterQuotes, Consumer<SyntaxNode> visitor) {
        if (node == null || node.tag().isModuleLike()) {
            return;
        }
        visitor.accept(node);
        if (node.is(NodeTag.QUOTE) && !enterQuotes) {
            return;
        }
        for (SyntaxNode child : node.children()) {
            walk(child, enterQuotes, visitor);
        }
    }
}
