package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.CaptureInfo;
import com.codeontology.core.model.CaptureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Finds capture expressions ({@code &...}) in a module body.
 *
 * <p>Captures are numbered per module in pre-order. Placeholders ({@code &1}) belong to their
 * shorthand capture and are not captures of their own. Remote capture receivers are resolved
 * through the module's directives.
 */
public class CaptureExtractor {

    private static final Logger log = LoggerFactory.getLogger(CaptureExtractor.class);

    public List<CaptureInfo> extract(List<SyntaxNode> statements, ExtractionScope scope) {
        List<CaptureInfo> found = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            visit(statement, scope, null, null, found);
        }
        return found;
    }

    private void visit(SyntaxNode node, ExtractionScope scope, String function, Integer arity,
                       List<CaptureInfo> found) {
        if (node == null || node.tag().isModuleLike() || node.is(NodeTag.QUOTE)
            || SyntaxNodes.isCapturePlaceholder(node)) {
            return;
        }
        String enclosing = function;
        Integer enclosingArity = arity;
        if (node.is(NodeTag.FUNCTION_DEF) && node.name() != null) {
            enclosing = node.name();
            enclosingArity = node.keywordValues("params").size();
        } else if (node.is(NodeTag.CAPTURE)) {
            capture(node, scope, function, arity, found.size()).ifPresent(found::add);
        }
        for (SyntaxNode child : node.children()) {
            visit(child, scope, enclosing, enclosingArity, found);
        }
    }

    private Optional<CaptureInfo> capture(SyntaxNode node, ExtractionScope scope, String function, Integer arity,
                                          int index) {
        if (node.children().size() != 1) {
            log.debug("Skipping capture with {} operands at {}", node.children().size(), node.location());
            return Optional.empty();
        }
        Optional<SyntaxNode> reference = SyntaxNodes.namedCaptureReference(node);
        if (reference.isPresent()) {
            return named(reference.get(), scope, function, arity, index, node);
        }
        List<Integer> placeholders = placeholders(node.children().get(0));
        int captureArity = placeholders.isEmpty() ? 0 : placeholders.get(placeholders.size() - 1);
        return Optional.of(new CaptureInfo(index, CaptureKind.SHORTHAND, null, null, captureArity, placeholders,
            function, arity, node.location()));
    }

    private Optional<CaptureInfo> named(SyntaxNode reference, ExtractionScope scope, String function,
                                        Integer arity, int index, SyntaxNode node) {
        SyntaxNode target = reference.children().get(0);
        String arityText = reference.children().get(1).textValue();
        int captureArity;
        try {
            captureArity = Integer.parseInt(arityText);
        } catch (NumberFormatException e) {
            log.debug("Skipping capture {} with arity {} at {}", target.name(), arityText, node.location());
            return Optional.empty();
        }
        if (captureArity < 0) {
            log.debug("Skipping capture {} with negative arity at {}", target.name(), node.location());
            return Optional.empty();
        }
        if (!target.is(NodeTag.REMOTE_CALL)) {
            return Optional.of(new CaptureInfo(index, CaptureKind.NAMED_LOCAL, null, target.name(), captureArity,
                List.of(), function, arity, node.location()));
        }
        // a receiver computed at runtime still names a function, only the module is unknown
        String module = scope.resolveModule(target.children().get(0)).orElse(null);
        return Optional.of(new CaptureInfo(index, CaptureKind.NAMED_REMOTE, module, target.name(), captureArity,
            List.of(), function, arity, node.location()));
    }

    private static List<Integer> placeholders(SyntaxNode body) {
        TreeSet<Integer> positions = new TreeSet<>();
        SyntaxNodes.walk(body, node -> {
            if (SyntaxNodes.isCapturePlaceholder(node)) {
                positions.add(Integer.parseInt(node.children().get(0).textValue()));
            }
        });
        return List.copyOf(positions);
    }
}
