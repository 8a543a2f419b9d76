package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.ExceptionInfo;
import com.codeontology.core.model.StructField;
import com.codeontology.core.model.StructInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts {@code defstruct} and {@code defexception} definitions together with
 * {@code @enforce_keys} and {@code @derive}.
 */
public class StructExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructExtractor.class);

    /**
     * Extracts the module's struct.
     *
     * @param statements module body statements
     * @param scope module scope
     * @return the struct, or empty when the module defines none
     */
    public Optional<StructInfo> struct(List<SyntaxNode> statements, ExtractionScope scope) {
        return find(statements, NodeTag.DEFSTRUCT).map(definition -> new StructInfo(
            scope.module(),
            fields(definition, enforcedKeys(statements)),
            derivedProtocols(statements, scope),
            definition.location()));
    }

    /**
     * Extracts the module's exception definition.
     *
     * <p>A {@code message} field default becomes the default message; a {@code message/1}
     * function marks a custom message.
     *
     * @param statements module body statements
     * @param scope module scope
     * @return the exception, or empty when the module defines none
     */
    public Optional<ExceptionInfo> exception(List<SyntaxNode> statements, ExtractionScope scope) {
        return find(statements, NodeTag.DEFEXCEPTION).map(definition -> {
            List<StructField> fields = fields(definition, enforcedKeys(statements));
            String defaultMessage = fields.stream()
                .filter(field -> "message".equals(field.name()) && field.hasDefault())
                .map(StructField::defaultValue)
                .findFirst()
                .orElse(null);
            boolean customMessage = statements.stream().anyMatch(statement ->
                statement.is(NodeTag.FUNCTION_DEF)
                    && "message".equals(statement.name())
                    && statement.keywordValues("params").size() == 1);
            return new ExceptionInfo(scope.module(), fields, defaultMessage, customMessage, definition.location());
        });
    }

    private static Optional<SyntaxNode> find(List<SyntaxNode> statements, NodeTag tag) {
        return statements.stream().filter(statement -> statement.is(tag)).findFirst();
    }

    private static List<StructField> fields(SyntaxNode definition, Set<String> enforced) {
        List<SyntaxNode> entries = new ArrayList<>();
        for (SyntaxNode child : definition.children()) {
            if (child.is(NodeTag.LIST)) {
                entries.addAll(child.children());
            } else {
                entries.add(child);
            }
        }
        List<StructField> fields = new ArrayList<>();
        for (SyntaxNode entry : entries) {
            if (entry.is(NodeTag.ATOM)) {
                String name = entry.textValue();
                fields.add(new StructField(name, null, false, enforced.contains(name)));
            } else if (entry.is(NodeTag.KEYWORD) && entry.name() != null) {
                SyntaxNode value = entry.children().isEmpty() ? null : entry.children().get(0);
                fields.add(new StructField(entry.name(), defaultText(value), true, enforced.contains(entry.name())));
            } else {
                log.debug("Skipping struct field of shape {} at {}", entry.tag(), entry.location());
            }
        }
        return fields;
    }

    private static String defaultText(SyntaxNode value) {
        if (value == null) {
            return "nil";
        }
        return value.is(NodeTag.STRING) ? value.textValue() : SyntaxNodes.render(value);
    }

    private static Set<String> enforcedKeys(List<SyntaxNode> statements) {
        Set<String> keys = new LinkedHashSet<>();
        for (SyntaxNode statement : statements) {
            if (!AttributeExtractor.isDefinition(statement, "enforce_keys")) {
                continue;
            }
            SyntaxNode value = statement.children().get(0);
            List<SyntaxNode> atoms = value.is(NodeTag.LIST) ? value.children() : List.of(value);
            for (SyntaxNode atom : atoms) {
                if (atom.is(NodeTag.ATOM)) {
                    keys.add(atom.textValue());
                }
            }
        }
        return keys;
    }

    private static List<String> derivedProtocols(List<SyntaxNode> statements, ExtractionScope scope) {
        Set<String> protocols = new LinkedHashSet<>();
        for (SyntaxNode statement : statements) {
            if (!AttributeExtractor.isDefinition(statement, "derive")) {
                continue;
            }
            SyntaxNode value = statement.children().get(0);
            List<SyntaxNode> entries = value.is(NodeTag.LIST) ? value.children() : List.of(value);
            for (SyntaxNode entry : entries) {
                // {Protocol, options}
                SyntaxNode reference = entry.is(NodeTag.TUPLE) && !entry.children().isEmpty()
                    ? entry.children().get(0)
                    : entry;
                scope.resolveModule(reference).ifPresent(protocols::add);
            }
        }
        return List.copyOf(protocols);
    }
}
