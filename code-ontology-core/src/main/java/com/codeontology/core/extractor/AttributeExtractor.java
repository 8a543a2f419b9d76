package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.AttributeInfo;
import com.codeontology.core.model.AttributeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts module attribute definitions from a module body.
 *
 * <p>Typespec attributes ({@code @type}, {@code @spec}, {@code @callback}, ...) are left to
 * {@link TypeSpecExtractor}. An attribute registered through
 * {@code Module.register_attribute(__MODULE__, :name, accumulate: true)} is flagged
 * accumulating.
 */
public class AttributeExtractor {

    private static final Logger log = LoggerFactory.getLogger(AttributeExtractor.class);

    /** Attributes holding typespecs rather than values. */
    public static final Set<String> TYPESPEC_ATTRIBUTES =
        Set.of("type", "typep", "opaque", "spec", "callback", "macrocallback");

    /**
     * Extracts attributes in source order.
     *
     * @param statements module body statements
     * @return attributes, indexed from 0
     */
    public List<AttributeInfo> extract(List<SyntaxNode> statements) {
        Set<String> accumulating = accumulatingAttributes(statements);
        List<AttributeInfo> attributes = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            if (!isDefinition(statement) || TYPESPEC_ATTRIBUTES.contains(statement.name())) {
                continue;
            }
            SyntaxNode value = statement.children().get(0);
            AttributeKind kind = AttributeKind.fromName(statement.name());
            attributes.add(new AttributeInfo(
                statement.name(),
                kind,
                valueText(value),
                kind.isDocumentation() && isFalse(value),
                accumulating.contains(statement.name()),
                attributes.size(),
                statement.location()));
        }
        log.trace("Extracted {} attributes", attributes.size());
        return attributes;
    }

    /**
     * Returns true for {@code @name value}; a bare {@code @name} is a read.
     *
     * @param node statement
     * @return whether the node defines an attribute
     */
    public static boolean isDefinition(SyntaxNode node) {
        return node != null && node.is(NodeTag.ATTRIBUTE) && node.name() != null && !node.children().isEmpty();
    }

    /**
     * Returns true if {@code node} defines the attribute {@code name}.
     *
     * @param node statement
     * @param name attribute name
     * @return whether it is {@code @name value}
     */
    public static boolean isDefinition(SyntaxNode node, String name) {
        return isDefinition(node) && name.equals(node.name());
    }

    /**
     * Returns the text of a documentation attribute.
     *
     * @param attribute {@code @doc}, {@code @moduledoc} or {@code @typedoc} node
     * @return the string, empty for {@code false} or non-string values
     */
    public static Optional<String> docText(SyntaxNode attribute) {
        if (!isDefinition(attribute)) {
            return Optional.empty();
        }
        SyntaxNode value = attribute.children().get(0);
        return value.is(NodeTag.STRING) || value.is(NodeTag.CHARLIST)
            ? Optional.ofNullable(value.textValue())
            : Optional.empty();
    }

    public static boolean isDocFalse(SyntaxNode attribute) {
        return isDefinition(attribute) && isFalse(attribute.children().get(0));
    }

    private static boolean isFalse(SyntaxNode value) {
        return value.is(NodeTag.BOOLEAN) && "false".equals(value.textValue());
    }

    private static String valueText(SyntaxNode value) {
        return value.is(NodeTag.STRING) ? value.textValue() : SyntaxNodes.render(value);
    }

    private static Set<String> accumulatingAttributes(List<SyntaxNode> statements) {
        Set<String> names = new HashSet<>();
        for (SyntaxNode statement : statements) {
            if (!statement.is(NodeTag.REMOTE_CALL) || !"register_attribute".equals(statement.name())) {
                continue;
            }
            List<SyntaxNode> args = statement.children();
            if (args.size() < 3 || !"Module".equals(args.get(0).name())) {
                continue;
            }
            SyntaxNode name = args.get(2);
            boolean accumulate = args.stream().anyMatch(AttributeExtractor::isAccumulateTrue);
            if (accumulate && name.is(NodeTag.ATOM)) {
                names.add(name.textValue());
            }
        }
        return names;
    }

    private static boolean isAccumulateTrue(SyntaxNode node) {
        if (node.is(NodeTag.LIST)) {
            return node.children().stream().anyMatch(AttributeExtractor::isAccumulateTrue);
        }
        return node.is(NodeTag.KEYWORD) && "accumulate".equals(node.name())
            && node.children().size() == 1 && "true".equals(node.children().get(0).textValue());
    }
}
