package com.codeontology.core.directive;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts {@code import} directives with their {@code only:} and {@code except:} selectors.
 *
 * <p>A selector is a category atom ({@code :functions}, {@code :macros}, {@code :sigils}) or a
 * keyword list of {@code name: arity} pairs, either wrapped in a {@code LIST} node or given as
 * keyword children directly.
 */
public class ImportExtractor extends AbstractDirectiveExtractor<ImportDirective> {

    @Override
    public DirectiveKind kind() {
        return DirectiveKind.IMPORT;
    }

    @Override
    protected DirectiveResult<ImportDirective> build(List<String> source, SyntaxNode node, SourceLocation location) {
        ImportSelector only = null;
        ImportSelector except = null;
        if (node.hasKeyword("only")) {
            Optional<ImportSelector> parsed = selector(node.keywordValues("only"));
            if (parsed.isEmpty()) {
                return DirectiveResult.notADirective("Invalid only: selector on import " + String.join(".", source), location);
            }
            only = parsed.get();
        }
        if (node.hasKeyword("except")) {
            Optional<ImportSelector> parsed = selector(node.keywordValues("except"));
            if (parsed.isEmpty()) {
                return DirectiveResult.notADirective("Invalid except: selector on import " + String.join(".", source), location);
            }
            except = parsed.get();
        }
        return DirectiveResult.ok(new ImportDirective(source, only, except, location, Scope.MODULE));
    }

    @Override
    protected ImportDirective expanded(List<String> source, SyntaxNode group, SourceLocation location) {
        return new ImportDirective(source, null, null, location, Scope.MODULE);
    }

    private Optional<ImportSelector> selector(List<SyntaxNode> values) {
        if (values.size() == 1 && values.get(0).is(NodeTag.ATOM)) {
            String category = values.get(0).textValue();
            if (!ImportSelector.CATEGORIES.contains(category)) {
                log.debug("Unknown import category: {}", category);
                return Optional.empty();
            }
            return Optional.of(ImportSelector.category(category));
        }
        List<SyntaxNode> entries = values.size() == 1 && values.get(0).is(NodeTag.LIST)
            ? values.get(0).children()
            : values;
        List<ImportedFunction> functions = new ArrayList<>();
        for (SyntaxNode entry : entries) {
            Optional<ImportedFunction> function = function(entry);
            if (function.isEmpty()) {
                log.debug("Invalid import selector entry: {}", SyntaxNodes.render(entry));
                return Optional.empty();
            }
            functions.add(function.get());
        }
        return Optional.of(ImportSelector.of(functions));
    }

    private static Optional<ImportedFunction> function(SyntaxNode entry) {
        if (!entry.is(NodeTag.KEYWORD) || entry.name() == null || entry.children().size() != 1) {
            return Optional.empty();
        }
        SyntaxNode arity = entry.children().get(0);
        if (!arity.is(NodeTag.INTEGER) || arity.value() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ImportedFunction(entry.name(), Integer.parseInt(arity.textValue())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
