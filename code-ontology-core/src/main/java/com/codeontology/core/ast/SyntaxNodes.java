package com.codeontology.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Construction and navigation helpers for {@link SyntaxNode} trees.
 *
 * <p>The factories mirror the shapes documented on {@link SyntaxNode} and are used by
 * extractors, tests and tools that assemble trees programmatically:
 * <pre>{@code
 * SyntaxNode module = SyntaxNodes.module("MyApp.Users",
 *     SyntaxNodes.alias("MyApp.Repo"),
 *     SyntaxNodes.def("get", List.of(SyntaxNodes.var("id")), SyntaxNodes.var("id")));
 * }</pre>
 */
public final class SyntaxNodes {

    private SyntaxNodes() {
        // Utility class - no instantiation
    }

    // ==================== Factories ====================

    public static SyntaxNode node(NodeTag tag, SyntaxNode... children) {
        return new SyntaxNode(tag, null, null, null, Arrays.asList(children));
    }

    public static SyntaxNode named(NodeTag tag, String name, SyntaxNode... children) {
        return new SyntaxNode(tag, name, null, null, Arrays.asList(children));
    }

    public static SyntaxNode named(NodeTag tag, String name, List<SyntaxNode> children) {
        return new SyntaxNode(tag, name, null, null, children);
    }

    /**
     * Returns a copy of {@code node} positioned at the given lines.
     *
     * @param node node to relocate
     * @param startLine first line
     * @param endLine last line
     * @return relocated copy
     */
    public static SyntaxNode at(SyntaxNode node, int startLine, int endLine) {
        return new SyntaxNode(node.tag(), node.name(), node.value(),
            SourceLocation.of(startLine, endLine), node.children());
    }

    public static SyntaxNode at(SyntaxNode node, int line) {
        return at(node, line, line);
    }

    public static SyntaxNode moduleName(String dotted) {
        return named(NodeTag.MODULE_NAME, dotted);
    }

    public static SyntaxNode kw(String label, SyntaxNode... values) {
        return named(NodeTag.KEYWORD, label, values);
    }

    public static SyntaxNode kw(String label, List<SyntaxNode> values) {
        return named(NodeTag.KEYWORD, label, values);
    }

    public static SyntaxNode block(SyntaxNode... statements) {
        return node(NodeTag.BLOCK, statements);
    }

    public static SyntaxNode block(List<SyntaxNode> statements) {
        return new SyntaxNode(NodeTag.BLOCK, null, null, null, statements);
    }

    public static SyntaxNode module(String name, SyntaxNode... body) {
        return node(NodeTag.MODULE_DEF, moduleName(name), kw("do", block(body)));
    }

    /**
     * Creates a function definition node.
     *
     * @param form definition form ({@code def}, {@code defp}, {@code defmacro}, ...)
     * @param name function name
     * @param params parameter patterns
     * @param guard guard expression, or null
     * @param body body expression, or null for a bodiless head
     * @return the definition node
     */
    public static SyntaxNode function(String form, String name, List<SyntaxNode> params,
                                      SyntaxNode guard, SyntaxNode body) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(kw("params", params));
        if (guard != null) {
            children.add(kw("when", guard));
        }
        if (body != null) {
            children.add(kw("do", body));
        }
        return new SyntaxNode(NodeTag.FUNCTION_DEF, name, form, null, children);
    }

    public static SyntaxNode def(String name, List<SyntaxNode> params, SyntaxNode body) {
        return function("def", name, params, null, body);
    }

    public static SyntaxNode defp(String name, List<SyntaxNode> params, SyntaxNode body) {
        return function("defp", name, params, null, body);
    }

    public static SyntaxNode defdelegate(String name, List<SyntaxNode> params, String target, String as) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(kw("params", params));
        children.add(kw("to", moduleName(target)));
        if (as != null) {
            children.add(kw("as", atom(as)));
        }
        return new SyntaxNode(NodeTag.FUNCTION_DEF, name, "defdelegate", null, children);
    }

    public static SyntaxNode clause(List<SyntaxNode> params, SyntaxNode guard, SyntaxNode body) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(kw("params", params));
        if (guard != null) {
            children.add(kw("when", guard));
        }
        children.add(kw("do", body));
        return new SyntaxNode(NodeTag.CLAUSE, null, null, null, children);
    }

    public static SyntaxNode fn(SyntaxNode... clauses) {
        return node(NodeTag.ANONYMOUS_FUNCTION, clauses);
    }

    public static SyntaxNode alias(String target) {
        return node(NodeTag.ALIAS, moduleName(target));
    }

    public static SyntaxNode aliasAs(String target, String as) {
        return node(NodeTag.ALIAS, moduleName(target), kw("as", moduleName(as)));
    }

    public static SyntaxNode multi(String prefix, SyntaxNode... targets) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(moduleName(prefix));
        children.addAll(Arrays.asList(targets));
        return new SyntaxNode(NodeTag.MULTI_ALIAS, null, null, null, children);
    }

    public static SyntaxNode var(String name) {
        return named(NodeTag.VARIABLE, name);
    }

    public static SyntaxNode atom(String value) {
        return literal(NodeTag.ATOM, value);
    }

    public static SyntaxNode string(String value) {
        return literal(NodeTag.STRING, value);
    }

    public static SyntaxNode integer(long value) {
        return literal(NodeTag.INTEGER, value);
    }

    public static SyntaxNode bool(boolean value) {
        return literal(NodeTag.BOOLEAN, value);
    }

    public static SyntaxNode literal(NodeTag tag, Object value) {
        return new SyntaxNode(tag, null, value, null, List.of());
    }

    public static SyntaxNode capture(SyntaxNode body) {
        return node(NodeTag.CAPTURE, body);
    }

    public static SyntaxNode placeholder(int position) {
        return capture(integer(position));
    }

    public static SyntaxNode call(String name, SyntaxNode... args) {
        return named(NodeTag.LOCAL_CALL, name, args);
    }

    public static SyntaxNode remoteCall(String module, String name, SyntaxNode... args) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(moduleName(module));
        children.addAll(Arrays.asList(args));
        return named(NodeTag.REMOTE_CALL, name, children);
    }

    public static SyntaxNode op(String symbol, SyntaxNode... operands) {
        return named(NodeTag.OPERATOR, symbol, operands);
    }

    public static SyntaxNode attribute(String name, SyntaxNode value) {
        return value == null ? named(NodeTag.ATTRIBUTE, name) : named(NodeTag.ATTRIBUTE, name, value);
    }

    // ==================== Navigation ====================

    /**
     * Flattens a body into its statements.
     *
     * <p>A {@code BLOCK} yields its children, a missing body yields nothing and any other node
     * is a single statement.
     *
     * @param body body node, possibly null
     * @return statements in source order
     */
    public static List<SyntaxNode> statements(SyntaxNode body) {
        if (body == null) {
            return List.of();
        }
        if (body.is(NodeTag.BLOCK)) {
            return body.children();
        }
        return List.of(body);
    }

    /**
     * Returns the statements of a definition's {@code do} block.
     *
     * @param definition module, function, clause or protocol node
     * @return statements, empty when there is no body
     */
    public static List<SyntaxNode> body(SyntaxNode definition) {
        return statements(definition.keywordValue("do").orElse(null));
    }

    /**
     * Splits a module reference into its name segments.
     *
     * @param node module name node
     * @return segments, or empty when the node is not a module reference
     */
    public static Optional<List<String>> segments(SyntaxNode node) {
        if (node == null || !node.is(NodeTag.MODULE_NAME) || node.name() == null || node.name().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(List.of(node.name().split("\\.")));
    }

    /**
     * Renders a module-ish node as a dotted name.
     *
     * <p>Module names render as written; atoms (Erlang modules) render with a leading colon.
     *
     * @param node module reference
     * @return dotted name, or empty for other shapes
     */
    public static Optional<String> moduleNameOf(SyntaxNode node) {
        if (node == null) {
            return Optional.empty();
        }
        return switch (node.tag()) {
            case MODULE_NAME -> Optional.ofNullable(node.name());
            case ATOM -> Optional.ofNullable(node.textValue()).map(v -> ":" + v);
            default -> Optional.empty();
        };
    }

    /**
     * Returns true for a capture placeholder such as {@code &1}.
     *
     * @param node node to test
     * @return true for a capture holding a positive integer
     */
    public static boolean isCapturePlaceholder(SyntaxNode node) {
        if (node == null || !node.is(NodeTag.CAPTURE) || node.children().size() != 1) {
            return false;
        }
        SyntaxNode position = node.children().get(0);
        if (!position.is(NodeTag.INTEGER) || position.textValue() == null) {
            return false;
        }
        try {
            return Integer.parseInt(position.textValue()) > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Returns the {@code name/arity} operator of a named capture.
     *
     * <p>The operator's first child is a variable-shaped or argument-less local call for
     * {@code &name/arity}, or an argument-less remote call for {@code &Mod.name/arity}; its
     * second child is the arity.
     *
     * @param node capture node
     * @return the {@code /} operator, or empty for shorthand captures and other nodes
     */
    public static Optional<SyntaxNode> namedCaptureReference(SyntaxNode node) {
        if (node == null || !node.is(NodeTag.CAPTURE) || node.children().size() != 1) {
            return Optional.empty();
        }
        SyntaxNode reference = node.children().get(0);
        if (!reference.is(NodeTag.OPERATOR) || !"/".equals(reference.name()) || reference.children().size() != 2
            || !reference.children().get(1).is(NodeTag.INTEGER)) {
            return Optional.empty();
        }
        SyntaxNode target = reference.children().get(0);
        boolean named = target.name() != null && switch (target.tag()) {
            case VARIABLE -> true;
            case LOCAL_CALL -> target.children().isEmpty();
            case REMOTE_CALL -> target.children().size() == 1;
            default -> false;
        };
        return named ? Optional.of(reference) : Optional.empty();
    }

    /**
     * Visits {@code root} and all descendants in pre-order, left to right.
     *
     * @param root starting node
     * @param visitor callback
     */
    public static void walk(SyntaxNode root, Consumer<SyntaxNode> visitor) {
        if (root == null) {
            return;
        }
        visitor.accept(root);
        for (SyntaxNode child : root.children()) {
            walk(child, visitor);
        }
    }

    /**
     * Renders a node in a compact source-like form for literal values and diagnostics.
     *
     * @param node node to render
     * @return printable text
     */
    public static String render(SyntaxNode node) {
        if (node == null) {
            return "nil";
        }
        return switch (node.tag()) {
            case ATOM -> ":" + node.textValue();
            case STRING -> "\"" + node.textValue() + "\"";
            case CHARLIST -> "'" + node.textValue() + "'";
            case INTEGER, FLOAT, BOOLEAN -> node.textValue();
            case NIL -> "nil";
            case VARIABLE, MODULE_NAME -> node.name();
            case WILDCARD -> "_";
            case PIN -> "^" + renderChildren(node, ", ");
            case ATTRIBUTE -> "@" + node.name();
            case LIST -> "[" + renderChildren(node, ", ") + "]";
            case TUPLE -> "{" + renderChildren(node, ", ") + "}";
            case MAP -> "%{" + renderChildren(node, ", ") + "}";
            case KEYWORD -> node.name() + ": " + renderChildren(node, ", ");
            case STRUCT -> "%" + renderChildren(node, "");
            case MATCH -> renderChildren(node, " = ");
            case OPERATOR -> node.children().size() == 1
                ? node.name() + render(node.children().get(0))
                : renderChildren(node, " " + node.name() + " ");
            case LOCAL_CALL -> node.name() + "(" + renderChildren(node, ", ") + ")";
            case REMOTE_CALL -> renderRemote(node);
            case CAPTURE -> "&" + renderChildren(node, "");
            default -> node.tag().name().toLowerCase();
        };
    }

    private static String renderRemote(SyntaxNode node) {
        List<SyntaxNode> children = node.children();
        if (children.isEmpty()) {
            return node.name() + "()";
        }
        StringBuilder args = new StringBuilder();
        for (int i = 1; i < children.size(); i++) {
            if (i > 1) {
                args.append(", ");
            }
            args.append(render(children.get(i)));
        }
        return render(children.get(0)) + "." + node.name() + "(" + args + ")";
    }

    private static String renderChildren(SyntaxNode node, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < node.children().size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(render(node.children().get(i)));
        }
        return sb.toString();
    }
}
