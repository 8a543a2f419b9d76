package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.HygieneViolationInfo;
import com.codeontology.core.model.HygieneViolationType;
import com.codeontology.core.model.QuoteInfo;
import com.codeontology.core.model.UnquoteInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts {@code quote} blocks, their options, the {@code unquote} calls inside them and
 * hygiene escapes ({@code var!/1,2}, {@code Macro.escape/1}).
 *
 * <p>Quotes are numbered per module in pre-order. A quote nested in another quote is its own
 * entry and its unquotes belong to it alone.
 */
public class QuoteExtractor {

    public List<QuoteInfo> extract(List<SyntaxNode> statements) {
        List<SyntaxNode> quotes = new ArrayList<>();
        BodyWalker.walk(statements, true, node -> {
            if (node.is(NodeTag.QUOTE)) {
                quotes.add(node);
            }
        });
        List<QuoteInfo> result = new ArrayList<>(quotes.size());
        for (SyntaxNode quote : quotes) {
            result.add(describe(quote, result.size()));
        }
        return result;
    }

    private QuoteInfo describe(SyntaxNode quote, int index) {
        String context = option(quote, "context").map(QuoteExtractor::renderContext).orElse(null);
        boolean locationKeep = option(quote, "location")
            .filter(value -> value.is(NodeTag.ATOM) && "keep".equals(value.textValue()))
            .isPresent();
        boolean unquoteEnabled = option(quote, "unquote")
            .map(value -> !(value.is(NodeTag.BOOLEAN) && "false".equals(value.textValue())))
            .orElse(true);
        boolean generated = option(quote, "generated")
            .filter(value -> value.is(NodeTag.BOOLEAN) && "true".equals(value.textValue()))
            .isPresent();

        List<UnquoteInfo> unquotes = new ArrayList<>();
        List<HygieneViolationInfo> violations = new ArrayList<>();
        for (SyntaxNode body : quote.keywordValues("do")) {
            scan(body, 0, context, unquotes, violations);
        }
        return new QuoteInfo(index, context, quote.hasKeyword("bind_quoted"), locationKeep, unquoteEnabled,
            generated, unquotes, violations, quote.location());
    }

    private void scan(SyntaxNode node, int unquoteDepth, String context,
                      List<UnquoteInfo> unquotes, List<HygieneViolationInfo> violations) {
        if (node == null || node.is(NodeTag.QUOTE) || node.tag().isModuleLike()) {
            return;
        }
        int depth = unquoteDepth;
        if (node.is(NodeTag.UNQUOTE) || node.is(NodeTag.UNQUOTE_SPLICING)) {
            depth = unquoteDepth + 1;
            String expression = node.children().isEmpty() ? "" : SyntaxNodes.render(node.children().get(0));
            unquotes.add(new UnquoteInfo(node.is(NodeTag.UNQUOTE_SPLICING), depth, expression, node.location()));
        } else if (node.is(NodeTag.LOCAL_CALL) && "var!".equals(node.name()) && !node.children().isEmpty()) {
            List<SyntaxNode> args = node.positional();
            String variable = args.isEmpty() ? null : args.get(0).name();
            String violationContext = args.size() > 1 ? renderContext(args.get(1)) : context;
            violations.add(new HygieneViolationInfo(
                HygieneViolationType.VAR_BANG, variable, violationContext, node.location()));
        } else if (node.is(NodeTag.REMOTE_CALL) && "escape".equals(node.name()) && !node.children().isEmpty()
            && "Macro".equals(node.children().get(0).name())) {
            String variable = node.children().size() > 1 ? SyntaxNodes.render(node.children().get(1)) : null;
            violations.add(new HygieneViolationInfo(
                HygieneViolationType.MACRO_ESCAPE, variable, context, node.location()));
        }
        for (SyntaxNode child : node.children()) {
            scan(child, depth, context, unquotes, violations);
        }
    }

    private static Optional<SyntaxNode> option(SyntaxNode quote, String key) {
        return quote.keywordValue(key);
    }

    private static String renderContext(SyntaxNode value) {
        return value.is(NodeTag.MODULE_NAME) || value.is(NodeTag.VARIABLE)
            ? value.name()
            : SyntaxNodes.render(value);
    }
}
