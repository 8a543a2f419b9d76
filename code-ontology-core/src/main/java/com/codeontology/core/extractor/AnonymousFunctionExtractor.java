package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.closure.ClosureAnalyzer;
import com.codeontology.core.model.AnonymousFunctionInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds {@code fn ... end} expressions in a module body.
 *
 * <p>Functions are numbered per module in pre-order; nested anonymous functions follow their
 * parent. Each record names the named function it appears in, if any.
 */
public class AnonymousFunctionExtractor {

    public List<AnonymousFunctionInfo> extract(List<SyntaxNode> statements) {
        List<AnonymousFunctionInfo> found = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            visit(statement, null, null, found);
        }
        return found;
    }

    private void visit(SyntaxNode node, String function, Integer arity, List<AnonymousFunctionInfo> found) {
        if (node == null || node.tag().isModuleLike() || node.is(NodeTag.QUOTE)) {
            return;
        }
        String enclosing = function;
        Integer enclosingArity = arity;
        if (node.is(NodeTag.FUNCTION_DEF) && node.name() != null) {
            enclosing = node.name();
            enclosingArity = node.keywordValues("params").size();
        } else if (node.is(NodeTag.ANONYMOUS_FUNCTION)) {
            found.add(new AnonymousFunctionInfo(
                found.size(), ClosureAnalyzer.clausesOf(node), function, arity, node.location()));
        }
        for (SyntaxNode child : node.children()) {
            visit(child, enclosing, enclosingArity, found);
        }
    }
}
