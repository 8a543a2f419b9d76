package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.FunctionSpecInfo;
import com.codeontology.core.model.SpecKind;
import com.codeontology.core.model.TypeDefinitionInfo;
import com.codeontology.core.model.TypeExpression;
import com.codeontology.core.model.TypeExpressionKind;
import com.codeontology.core.model.TypeVisibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts type definitions and function specs.
 *
 * <p>Shapes:
 * <ul>
 *   <li>{@code @type name(a) :: expr}: {@code ATTRIBUTE type [OPERATOR :: [LOCAL_CALL name [a], expr]]};
 *       a head without parameters may be a {@code VARIABLE}</li>
 *   <li>{@code @spec f(t) :: r when a: t}: {@code ATTRIBUTE spec [OPERATOR when [OPERATOR :: [...],
 *       KEYWORD a ...]]}</li>
 *   <li>function types: {@code OPERATOR -> [LIST params, return]}</li>
 * </ul>
 */
public class TypeSpecExtractor {

    private static final Logger log = LoggerFactory.getLogger(TypeSpecExtractor.class);

    /** Built-in types usable without parentheses. */
    static final Set<String> BUILTIN_TYPES = Set.of(
        "any", "none", "atom", "map", "pid", "port", "reference", "struct", "tuple", "float",
        "integer", "neg_integer", "non_neg_integer", "pos_integer", "list", "nonempty_list",
        "maybe_improper_list", "nonempty_improper_list", "term", "arity", "as_boolean", "binary",
        "bitstring", "boolean", "byte", "char", "charlist", "nonempty_charlist", "fun", "function",
        "identifier", "iodata", "iolist", "keyword", "module", "mfa", "no_return", "node", "number",
        "timeout", "string", "nonempty_string", "nil", "dynamic");

    /**
     * Extracts {@code @type}, {@code @typep} and {@code @opaque} definitions.
     *
     * @param statements module body statements
     * @return type definitions in source order
     */
    public List<TypeDefinitionInfo> types(List<SyntaxNode> statements) {
        List<TypeDefinitionInfo> types = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            if (!AttributeExtractor.isDefinition(statement)) {
                continue;
            }
            String attribute = statement.name();
            if (!"type".equals(attribute) && !"typep".equals(attribute) && !"opaque".equals(attribute)) {
                continue;
            }
            SyntaxNode definition = statement.children().get(0);
            if (!isTypeOperator(definition)) {
                log.debug("Skipping malformed @{} at {}", attribute, statement.location());
                continue;
            }
            SyntaxNode head = definition.children().get(0);
            Optional<String> name = headName(head);
            if (name.isEmpty()) {
                log.debug("Skipping @{} with head {}", attribute, head.tag());
                continue;
            }
            List<String> parameters = head.is(NodeTag.LOCAL_CALL)
                ? head.positional().stream().map(p -> p.name() != null ? p.name() : SyntaxNodes.render(p)).toList()
                : List.of();
            types.add(new TypeDefinitionInfo(
                name.get(),
                parameters.size(),
                TypeVisibility.fromAttribute(attribute),
                parameters,
                parseType(definition.children().get(1)),
                statement.location()));
        }
        return types;
    }

    /**
     * Extracts {@code @spec}, {@code @callback} and {@code @macrocallback} signatures.
     *
     * <p>Callbacks listed in {@code @optional_callbacks} are flagged optional.
     *
     * @param statements module body statements
     * @return specs in source order
     */
    public List<FunctionSpecInfo> specs(List<SyntaxNode> statements) {
        Set<FunctionSignature> optional = optionalCallbacks(statements);
        List<FunctionSpecInfo> specs = new ArrayList<>();
        for (SyntaxNode statement : statements) {
            if (!AttributeExtractor.isDefinition(statement)) {
                continue;
            }
            String attribute = statement.name();
            if (!"spec".equals(attribute) && !"callback".equals(attribute) && !"macrocallback".equals(attribute)) {
                continue;
            }
            spec(statement, SpecKind.fromAttribute(attribute)).ifPresent(spec ->
                specs.add(spec.kind() != SpecKind.SPEC && optional.contains(spec.signature())
                    ? spec.withOptional(true)
                    : spec));
        }
        return specs;
    }

    private Optional<FunctionSpecInfo> spec(SyntaxNode statement, SpecKind kind) {
        SyntaxNode definition = statement.children().get(0);
        List<String> typeVariables = new ArrayList<>();
        if (definition.is(NodeTag.OPERATOR) && "when".equals(definition.name()) && !definition.children().isEmpty()) {
            for (SyntaxNode constraint : definition.children().subList(1, definition.children().size())) {
                collectConstraintNames(constraint, typeVariables);
            }
            definition = definition.children().get(0);
        }
        if (!isTypeOperator(definition)) {
            log.debug("Skipping malformed @{} at {}", statement.name(), statement.location());
            return Optional.empty();
        }
        SyntaxNode head = definition.children().get(0);
        Optional<String> name = headName(head);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        List<TypeExpression> parameterTypes = head.is(NodeTag.LOCAL_CALL)
            ? head.positional().stream().map(this::parseType).toList()
            : List.of();
        return Optional.of(new FunctionSpecInfo(
            name.get(),
            parameterTypes.size(),
            kind,
            parameterTypes,
            parseType(definition.children().get(1)),
            typeVariables,
            false,
            statement.location()));
    }

    /**
     * Parses a type expression node.
     *
     * @param node type node
     * @return parsed expression
     */
    public TypeExpression parseType(SyntaxNode node) {
        String text = SyntaxNodes.render(node);
        return switch (node.tag()) {
            case OPERATOR -> parseOperator(node, text);
            case TUPLE -> structural(TypeExpressionKind.TUPLE, node.children(), text);
            case LIST -> structural(TypeExpressionKind.LIST, node.children(), text);
            case MAP -> structural(TypeExpressionKind.MAP, mapElements(node), text);
            case STRUCT -> new TypeExpression(TypeExpressionKind.MAP,
                node.children().isEmpty() ? null : node.children().get(0).name(), null,
                node.children().size() > 1
                    ? mapElements(node.children().get(1)).stream().map(this::parseType).toList()
                    : List.of(),
                text);
            case LOCAL_CALL -> parseLocal(node, text);
            case REMOTE_CALL -> new TypeExpression(TypeExpressionKind.REMOTE, node.name(),
                node.children().isEmpty() ? null : SyntaxNodes.moduleNameOf(node.children().get(0)).orElse(null),
                node.children().stream().skip(1).map(this::parseType).toList(), text);
            case VARIABLE -> BUILTIN_TYPES.contains(node.name())
                ? new TypeExpression(TypeExpressionKind.BASIC, node.name(), null, List.of(), text)
                : new TypeExpression(TypeExpressionKind.VARIABLE, node.name(), null, List.of(), text);
            case ATOM, INTEGER, FLOAT, BOOLEAN, NIL, STRING, CHARLIST ->
                new TypeExpression(TypeExpressionKind.LITERAL, node.textValue(), null, List.of(), text);
            default -> new TypeExpression(TypeExpressionKind.BASIC, null, null, List.of(), text);
        };
    }

    private TypeExpression parseOperator(SyntaxNode node, String text) {
        String symbol = node.name();
        if ("|".equals(symbol)) {
            List<TypeExpression> members = new ArrayList<>();
            flattenUnion(node, members);
            return new TypeExpression(TypeExpressionKind.UNION, null, null, members, text);
        }
        if ("->".equals(symbol) && node.children().size() == 2) {
            SyntaxNode params = node.children().get(0);
            List<TypeExpression> elements = new ArrayList<>();
            if (params.is(NodeTag.LIST)) {
                params.children().forEach(p -> elements.add(parseType(p)));
            } else {
                elements.add(parseType(params));
            }
            elements.add(parseType(node.children().get(1)));
            return new TypeExpression(TypeExpressionKind.FUNCTION, null, null, elements, text);
        }
        if ("..".equals(symbol)) {
            return new TypeExpression(TypeExpressionKind.LITERAL, text, null, List.of(), text);
        }
        return new TypeExpression(TypeExpressionKind.BASIC, null, null, List.of(), text);
    }

    private TypeExpression parseLocal(SyntaxNode node, String text) {
        List<SyntaxNode> args = node.positional();
        if (args.isEmpty()) {
            return new TypeExpression(TypeExpressionKind.BASIC, node.name(), null, List.of(), text);
        }
        List<TypeExpression> elements = args.stream().map(this::parseType).toList();
        TypeExpressionKind kind = "list".equals(node.name()) || "nonempty_list".equals(node.name())
            ? TypeExpressionKind.LIST
            : TypeExpressionKind.PARAMETERIZED;
        return new TypeExpression(kind, node.name(), null, elements, text);
    }

    private TypeExpression structural(TypeExpressionKind kind, List<SyntaxNode> children, String text) {
        return new TypeExpression(kind, null, null, children.stream().map(this::parseType).toList(), text);
    }

    private void flattenUnion(SyntaxNode node, List<TypeExpression> members) {
        if (node.is(NodeTag.OPERATOR) && "|".equals(node.name())) {
            node.children().forEach(child -> flattenUnion(child, members));
        } else {
            members.add(parseType(node));
        }
    }

    // key and value types of `%{k => v}` / `%{k: v}` in order
    private static List<SyntaxNode> mapElements(SyntaxNode map) {
        List<SyntaxNode> elements = new ArrayList<>();
        for (SyntaxNode entry : map.children()) {
            if (entry.is(NodeTag.OPERATOR) && "=>".equals(entry.name())) {
                elements.addAll(entry.children());
            } else if (entry.is(NodeTag.KEYWORD)) {
                elements.add(SyntaxNodes.atom(entry.name()));
                elements.addAll(entry.children());
            } else {
                elements.add(entry);
            }
        }
        return elements;
    }

    private static boolean isTypeOperator(SyntaxNode node) {
        return node.is(NodeTag.OPERATOR) && "::".equals(node.name()) && node.children().size() == 2;
    }

    private static Optional<String> headName(SyntaxNode head) {
        if (head.is(NodeTag.LOCAL_CALL) || head.is(NodeTag.VARIABLE)) {
            return Optional.ofNullable(head.name());
        }
        return Optional.empty();
    }

    private static void collectConstraintNames(SyntaxNode constraint, List<String> names) {
        if (constraint.is(NodeTag.KEYWORD)) {
            names.add(constraint.name());
        } else if (constraint.is(NodeTag.LIST)) {
            constraint.children().forEach(child -> collectConstraintNames(child, names));
        }
    }

    /**
     * Reads {@code @optional_callbacks name: arity, ...}.
     *
     * @param statements module body statements
     * @return optional callback signatures
     */
    static Set<FunctionSignature> optionalCallbacks(List<SyntaxNode> statements) {
        Set<FunctionSignature> optional = new HashSet<>();
        for (SyntaxNode statement : statements) {
            if (!AttributeExtractor.isDefinition(statement, "optional_callbacks")) {
                continue;
            }
            for (SyntaxNode value : statement.children()) {
                List<SyntaxNode> entries = value.is(NodeTag.LIST) ? value.children() : List.of(value);
                for (SyntaxNode entry : entries) {
                    if (entry.is(NodeTag.KEYWORD) && entry.children().size() == 1
                        && entry.children().get(0).is(NodeTag.INTEGER)) {
                        String arity = entry.children().get(0).textValue();
                        try {
                            optional.add(new FunctionSignature(entry.name(), Integer.parseInt(arity)));
                        } catch (IllegalArgumentException e) {
                            log.debug("Skipping optional callback {} with arity {}", entry.name(), arity);
                        }
                    }
                }
            }
        }
        return optional;
    }
}
