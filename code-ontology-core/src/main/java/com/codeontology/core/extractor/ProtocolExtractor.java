package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.ProtocolFunctionInfo;
import com.codeontology.core.model.ProtocolImplementationInfo;
import com.codeontology.core.model.ProtocolInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts protocol definitions and implementations.
 *
 * <p>{@code defimpl P, for: [A, B]} yields one implementation per target type. Without
 * {@code for:} the implementation targets the enclosing module.
 */
public class ProtocolExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProtocolExtractor.class);

    /**
     * Extracts a {@code defprotocol}.
     *
     * @param definition {@code DEFPROTOCOL} node
     * @param name fully qualified protocol name
     * @return the protocol
     */
    public ProtocolInfo protocol(SyntaxNode definition, String name) {
        Objects.requireNonNull(definition, "definition must not be null");
        List<SyntaxNode> statements = SyntaxNodes.body(definition);
        List<ProtocolFunctionInfo> functions = new ArrayList<>();
        String pendingDoc = null;
        String moduledoc = null;
        boolean fallbackToAny = false;

        for (SyntaxNode statement : statements) {
            if (AttributeExtractor.isDefinition(statement, "moduledoc")) {
                moduledoc = AttributeExtractor.docText(statement).orElse(null);
            } else if (AttributeExtractor.isDefinition(statement, "doc")) {
                pendingDoc = AttributeExtractor.docText(statement).orElse(null);
            } else if (AttributeExtractor.isDefinition(statement, "fallback_to_any")) {
                fallbackToAny = "true".equals(statement.children().get(0).textValue());
            } else if (statement.is(NodeTag.FUNCTION_DEF) && statement.name() != null) {
                if (statement.hasKeyword("do")) {
                    log.debug("Protocol {} defines {} with a body; skipped", name, statement.name());
                    continue;
                }
                List<SyntaxNode> params = statement.keywordValues("params");
                functions.add(new ProtocolFunctionInfo(
                    statement.name(),
                    params.size(),
                    params.stream().map(SyntaxNodes::render).toList(),
                    pendingDoc,
                    statement.location()));
                pendingDoc = null;
            }
        }
        return new ProtocolInfo(name, functions, fallbackToAny, moduledoc, definition.location());
    }

    /**
     * Extracts a {@code defimpl}.
     *
     * @param definition {@code DEFIMPL} node
     * @param enclosingModule module containing the {@code defimpl}, or null at top level
     * @return one implementation per target type; empty when the protocol or target is missing
     */
    public List<ProtocolImplementationInfo> implementations(SyntaxNode definition, String enclosingModule) {
        Objects.requireNonNull(definition, "definition must not be null");
        String protocol = protocolName(definition);
        if (protocol == null) {
            log.debug("defimpl without protocol name at {}", definition.location());
            return List.of();
        }
        List<String> targets = targetTypes(definition, enclosingModule);
        if (targets.isEmpty()) {
            log.debug("defimpl {} without target type at {}", protocol, definition.location());
            return List.of();
        }
        Set<FunctionSignature> functions = new LinkedHashSet<>();
        for (SyntaxNode statement : SyntaxNodes.body(definition)) {
            if (statement.is(NodeTag.FUNCTION_DEF) && statement.name() != null) {
                functions.add(new FunctionSignature(statement.name(), statement.keywordValues("params").size()));
            }
        }
        List<ProtocolImplementationInfo> implementations = new ArrayList<>();
        for (String target : targets) {
            implementations.add(new ProtocolImplementationInfo(
                protocol, target, List.copyOf(functions), definition.location()));
        }
        return implementations;
    }

    /**
     * Returns the protocol named by a {@code defimpl}.
     *
     * @param definition {@code DEFIMPL} node
     * @return dotted protocol name, or null
     */
    public static String protocolName(SyntaxNode definition) {
        return definition.positional().stream()
            .filter(child -> child.is(NodeTag.MODULE_NAME))
            .findFirst()
            .map(SyntaxNode::name)
            .orElse(null);
    }

    /**
     * Returns the module name of an implementation.
     *
     * @param protocol protocol name
     * @param forType implementing type
     * @return {@code Protocol.Type}
     */
    public static String implementationName(String protocol, String forType) {
        return protocol + "." + forType;
    }

    /**
     * Returns the target types of a {@code defimpl}.
     *
     * @param definition {@code DEFIMPL} node
     * @param enclosingModule module containing it, used when {@code for:} is absent
     * @return target type names
     */
    public static List<String> targetTypes(SyntaxNode definition, String enclosingModule) {
        List<SyntaxNode> values = definition.keywordValues("for");
        if (values.isEmpty()) {
            return enclosingModule != null ? List.of(enclosingModule) : List.of();
        }
        List<String> targets = new ArrayList<>();
        for (SyntaxNode value : values) {
            List<SyntaxNode> entries = value.is(NodeTag.LIST) ? value.children() : List.of(value);
            for (SyntaxNode entry : entries) {
                if (entry.is(NodeTag.VARIABLE) && "__MODULE__".equals(entry.name()) && enclosingModule != null) {
                    targets.add(enclosingModule);
                } else if (entry.is(NodeTag.MODULE_NAME) && entry.name() != null) {
                    targets.add(entry.name());
                }
            }
        }
        return targets;
    }
}
