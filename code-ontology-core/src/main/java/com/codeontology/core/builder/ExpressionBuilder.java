package com.codeontology.core.builder;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.Literal;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds expression trees for guards and bodies.
 *
 * <p>The root expression takes its IRI {@code {base}expr/{module}/{n}} from the current module
 * and the context counter, and returns the advanced context. Outside a module the IRI is
 * {@code {base}expr/{n}}. Sub-expressions hang off their parent: {@code /left},
 * {@code /right} and {@code /operand} for operators, {@code /arg/{i}} for call arguments and
 * {@code /elem/{i}} for collection elements.
 */
public class ExpressionBuilder extends AbstractEntityBuilder<SyntaxNode> {

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "div", "rem");
    private static final Set<String> COMPARISON = Set.of("==", "!=", "===", "!==", "<", ">", "<=", ">=");
    private static final Set<String> LOGICAL = Set.of("and", "or", "not", "&&", "||", "!");
    private static final Set<String> LIST_OPERATORS = Set.of("++", "--", "|", "in");

    @Override
    public BuildResult build(SyntaxNode expression, BuildContext context) {
        Objects.requireNonNull(expression, "expression must not be null");
        BuildContext.Counted counted = context.nextCounter();
        Iri root = IriGenerator.forExpression(context.baseIri(), context.currentModule().orElse(null),
            counted.value());
        Walker walker = new Walker(context.baseIri());
        walker.visit(expression, root);
        return result(root, walker.triples, counted.context());
    }

    /**
     * Traversal state of one build call.
     */
    private final class Walker {
        private final String base;
        private final TripleBuilder triples = new TripleBuilder();

        Walker(String base) {
            this.base = base;
        }

        private void visit(SyntaxNode node, Iri iri) {
            switch (node.tag()) {
                case ATOM -> text(node, iri, Core.ATOM_LITERAL, Core.ATOM_VALUE);
                case INTEGER -> integer(node, iri);
                case FLOAT -> decimal(node, iri);
                case STRING -> text(node, iri, Core.STRING_LITERAL, Core.STRING_VALUE);
                case CHARLIST -> text(node, iri, Core.CHARLIST_LITERAL, Core.CHARLIST_VALUE);
                case BOOLEAN -> bool(node, iri);
                case NIL -> triples.type(iri, Core.NIL_LITERAL);
                case LIST -> collection(node, iri, Core.LIST_LITERAL);
                case TUPLE -> collection(node, iri, Core.TUPLE_LITERAL);
                case MAP -> collection(node, iri, Core.MAP_LITERAL);
                case VARIABLE -> triples.type(iri, Core.VARIABLE).string(iri, Core.NAME, node.name());
                case WILDCARD -> triples.type(iri, Core.WILDCARD_PATTERN);
                case MATCH -> binary(node, iri, Core.MATCH_OPERATOR, "=");
                case OPERATOR -> operator(node, iri);
                case LOCAL_CALL -> call(node, iri, Core.LOCAL_CALL, node.children());
                case REMOTE_CALL -> call(node, iri, Core.REMOTE_CALL,
                    node.children().isEmpty() ? List.of() : node.children().subList(1, node.children().size()));
                case DYNAMIC_CALL -> call(node, iri, Core.DYNAMIC_CALL,
                    node.children().isEmpty() ? List.of() : node.children().subList(1, node.children().size()));
                default -> triples.type(iri, Core.EXPRESSION);
            }
        }

        private void literal(Iri iri, Iri rdfClass, Iri property, Literal value) {
            triples.type(iri, rdfClass).value(iri, property, value);
        }

        private void text(SyntaxNode node, Iri iri, Iri rdfClass, Iri property) {
            String text = node.textValue();
            if (text == null) {
                unreadable(node, iri);
                return;
            }
            literal(iri, rdfClass, property, Literal.string(text));
        }

        // Integers are unbounded; the producer may write them as JSON numbers of any size.
        private void integer(SyntaxNode node, Iri iri) {
            String text = node.textValue();
            if (text == null) {
                unreadable(node, iri);
                return;
            }
            try {
                literal(iri, Core.INTEGER_LITERAL, Core.INTEGER_VALUE, Literal.integer(new BigInteger(text.trim())));
            } catch (NumberFormatException e) {
                unreadable(node, iri);
            }
        }

        private void decimal(SyntaxNode node, Iri iri) {
            String text = node.textValue();
            if (text == null) {
                unreadable(node, iri);
                return;
            }
            try {
                literal(iri, Core.FLOAT_LITERAL, Core.FLOAT_VALUE, Literal.decimal(Double.parseDouble(text)));
            } catch (NumberFormatException e) {
                unreadable(node, iri);
            }
        }

        private void bool(SyntaxNode node, Iri iri) {
            String text = node.textValue();
            if (!"true".equals(text) && !"false".equals(text)) {
                unreadable(node, iri);
                return;
            }
            literal(iri, Core.BOOLEAN_LITERAL, Core.BOOLEAN_VALUE, Literal.bool(Boolean.parseBoolean(text)));
        }

        private void unreadable(SyntaxNode node, Iri iri) {
            log.debug("Unreadable {} payload {} at {}", node.tag(), node.value(), iri);
            triples.type(iri, Core.EXPRESSION);
        }

        private void collection(SyntaxNode node, Iri iri, Iri rdfClass) {
            triples.type(iri, rdfClass);
            List<SyntaxNode> elements = node.children();
            for (int i = 0; i < elements.size(); i++) {
                Iri element = iri.resolve("/elem/" + i);
                triples.link(iri, Core.HAS_OPERAND, element);
                visit(elements.get(i), element);
            }
        }

        private void operator(SyntaxNode node, Iri iri) {
            String symbol = node.name() == null ? "" : node.name();
            Iri rdfClass;
            if (ARITHMETIC.contains(symbol)) {
                rdfClass = Core.ARITHMETIC_OPERATOR;
            } else if (COMPARISON.contains(symbol)) {
                rdfClass = Core.COMPARISON_OPERATOR;
            } else if (LOGICAL.contains(symbol)) {
                rdfClass = Core.LOGICAL_OPERATOR;
            } else if ("|>".equals(symbol)) {
                rdfClass = Core.PIPE_OPERATOR;
            } else if ("<>".equals(symbol)) {
                rdfClass = Core.STRING_CONCAT_OPERATOR;
            } else if (LIST_OPERATORS.contains(symbol)) {
                rdfClass = Core.LIST_OPERATOR;
            } else {
                rdfClass = Core.EXPRESSION;
            }
            if (node.children().size() == 1) {
                triples.type(iri, rdfClass).string(iri, Core.OPERATOR_SYMBOL, symbol);
                Iri operand = iri.resolve("/operand");
                triples.link(iri, Core.HAS_OPERAND, operand);
                visit(node.children().get(0), operand);
            } else {
                binary(node, iri, rdfClass, symbol);
            }
        }

        private void binary(SyntaxNode node, Iri iri, Iri rdfClass, String symbol) {
            triples.type(iri, rdfClass).string(iri, Core.OPERATOR_SYMBOL, symbol);
            List<SyntaxNode> operands = node.children();
            if (operands.size() != 2) {
                log.debug("Operator {} with {} operands", symbol, operands.size());
                return;
            }
            Iri left = iri.resolve("/left");
            Iri right = iri.resolve("/right");
            triples.link(iri, Core.HAS_LEFT_OPERAND, left).link(iri, Core.HAS_RIGHT_OPERAND, right);
            visit(operands.get(0), left);
            visit(operands.get(1), right);
        }

        private void call(SyntaxNode node, Iri iri, Iri rdfClass, List<SyntaxNode> arguments) {
            triples.type(iri, rdfClass).string(iri, Core.NAME, node.name());
            if (node.is(NodeTag.REMOTE_CALL) && !node.children().isEmpty() && node.children().get(0).name() != null) {
                triples.link(iri, Core.REFERS_TO_MODULE, IriGenerator.forModule(base, node.children().get(0).name()));
            }
            for (int i = 0; i < arguments.size(); i++) {
                Iri argument = iri.resolve("/arg/" + i);
                triples.link(iri, Core.HAS_ARGUMENT, argument);
                visit(arguments.get(i), argument);
            }
        }
    }
}
