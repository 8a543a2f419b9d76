package com.codeontology.core.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a parsed Elixir syntax tree.
 *
 * <p>The tree is produced by an external parser and handed to the pipeline as-is. Nodes are
 * immutable and only ever read. Labelled operands ({@code do}, {@code else}, {@code as},
 * {@code only}, {@code params}, {@code when}, ...) are {@link NodeTag#KEYWORD} children whose
 * {@code name} is the label and whose children are the operand values.
 *
 * <p><b>Shapes:</b>
 * <ul>
 *   <li>{@code MODULE_DEF}: {@code [MODULE_NAME, do:]}</li>
 *   <li>{@code FUNCTION_DEF}: name, value = form ({@code def}, {@code defp}, ...),
 *       {@code [params:, when:?, do:?, to:?, as:?]}</li>
 *   <li>{@code CLAUSE}: {@code [params:, when:?, do:]}</li>
 *   <li>{@code ALIAS}: {@code [MODULE_NAME | MULTI_ALIAS, as:?]}</li>
 *   <li>{@code IF}: {@code [condition, do:, else:?]}</li>
 *   <li>{@code REMOTE_CALL}: name, {@code [receiver, args...]}</li>
 * </ul>
 *
 * <p>JSON form (as read by the CLI):
 * <pre>{@code
 * {"tag": "FUNCTION_DEF", "name": "get", "value": "def",
 *  "location": {"startLine": 3, "endLine": 5},
 *  "children": [{"tag": "KEYWORD", "name": "params", "children": [...]}]}
 * }</pre>
 *
 * @param tag node shape
 * @param name identifier carried by the node (function, variable, attribute or module name),
 *             or null
 * @param value literal payload or definition form, or null
 * @param location source line range, or null when unknown
 * @param children operands in source order
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SyntaxNode(
    @JsonProperty("tag") NodeTag tag,
    @JsonProperty("name") String name,
    @JsonProperty("value") Object value,
    @JsonProperty("location") SourceLocation location,
    @JsonProperty("children") List<SyntaxNode> children
) {
    /**
     * Compact constructor with validation.
     */
    public SyntaxNode {
        if (tag == null) {
            tag = NodeTag.UNRECOGNIZED;
        }
        children = children != null ? List.copyOf(children) : List.of();
    }

    public boolean is(NodeTag expected) {
        return tag == expected;
    }

    /**
     * Returns the labelled operand node with the given label.
     *
     * @param label keyword label such as {@code "do"}
     * @return the keyword child, if present
     */
    public Optional<SyntaxNode> keyword(String label) {
        Objects.requireNonNull(label, "label must not be null");
        for (SyntaxNode child : children) {
            if (child.tag == NodeTag.KEYWORD && label.equals(child.name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first value of a labelled operand.
     *
     * @param label keyword label
     * @return first value node, if the keyword exists and has one
     */
    public Optional<SyntaxNode> keywordValue(String label) {
        return keyword(label).flatMap(k -> k.children.isEmpty()
            ? Optional.empty()
            : Optional.of(k.children.get(0)));
    }

    /**
     * Returns all values of a labelled operand.
     *
     * @param label keyword label
     * @return values, or an empty list when the keyword is absent
     */
    public List<SyntaxNode> keywordValues(String label) {
        return keyword(label).map(SyntaxNode::children).orElse(List.of());
    }

    public boolean hasKeyword(String label) {
        return keyword(label).isPresent();
    }

    /**
     * Returns the children that are not labelled operands.
     *
     * @return positional operands in source order
     */
    @JsonIgnore
    public List<SyntaxNode> positional() {
        return children.stream()
            .filter(child -> child.tag != NodeTag.KEYWORD)
            .toList();
    }

    /**
     * Returns the labelled operands.
     *
     * @return keyword children in source order
     */
    @JsonIgnore
    public List<SyntaxNode> keywords() {
        return children.stream()
            .filter(child -> child.tag == NodeTag.KEYWORD)
            .toList();
    }

    /**
     * Returns the literal payload as text.
     *
     * @return value rendered with {@link String#valueOf(Object)}, or null when absent
     */
    @JsonIgnore
    public String textValue() {
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Returns the start line, if known.
     *
     * @return start line or null
     */
    @JsonIgnore
    public Integer line() {
        return location == null ? null : location.startLine();
    }
}
