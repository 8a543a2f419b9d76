package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.directive.DirectiveScan;
import com.codeontology.core.directive.ScopeTracker;
import com.codeontology.core.model.FunctionInfo;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.ModuleAnalysis;
import com.codeontology.core.model.ModuleInfo;
import com.codeontology.core.model.ProtocolImplementationInfo;
import com.codeontology.core.model.TypeDefinitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts everything the graph builders need from one {@code defmodule}, {@code defprotocol}
 * or {@code defimpl}.
 *
 * <p>Nested module definitions are not entered; they are listed by name and extracted on their
 * own (see {@link SourceUnitExtractor}).
 *
 * <pre>{@code
 * ModuleAnalysis analysis = new ModuleExtractor().extract(moduleDef);
 * analysis.functions();   // [FunctionInfo[name=get, arity=1, ...]]
 * }</pre>
 */
public class ModuleExtractor {

    private static final Logger log = LoggerFactory.getLogger(ModuleExtractor.class);

    private final ScopeTracker scopeTracker;
    private final AttributeExtractor attributeExtractor = new AttributeExtractor();
    private final FunctionExtractor functionExtractor = new FunctionExtractor();
    private final TypeSpecExtractor typeSpecExtractor = new TypeSpecExtractor();
    private final StructExtractor structExtractor = new StructExtractor();
    private final BehaviourExtractor behaviourExtractor = new BehaviourExtractor(typeSpecExtractor);
    private final ProtocolExtractor protocolExtractor = new ProtocolExtractor();
    private final OtpExtractor otpExtractor = new OtpExtractor();
    private final CallExtractor callExtractor = new CallExtractor();
    private final ControlFlowExtractor controlFlowExtractor = new ControlFlowExtractor();
    private final AnonymousFunctionExtractor anonymousFunctionExtractor = new AnonymousFunctionExtractor();
    private final CaptureExtractor captureExtractor = new CaptureExtractor();
    private final QuoteExtractor quoteExtractor = new QuoteExtractor();
    private final MacroInvocationExtractor macroInvocationExtractor = new MacroInvocationExtractor();

    public ModuleExtractor() {
        this(new ScopeTracker());
    }

    public ModuleExtractor(ScopeTracker scopeTracker) {
        this.scopeTracker = Objects.requireNonNull(scopeTracker, "scopeTracker must not be null");
    }

    public ModuleAnalysis extract(SyntaxNode definition) {
        return extract(definition, null);
    }

    /**
     * Extracts one module-like definition.
     *
     * @param definition {@code MODULE_DEF}, {@code DEFPROTOCOL} or {@code DEFIMPL} node
     * @param parent enclosing module name, or null at top level
     * @return the module analysis
     * @throws IllegalArgumentException if the node is not module-like or has no name
     */
    public ModuleAnalysis extract(SyntaxNode definition, String parent) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (!definition.tag().isModuleLike()) {
            throw new IllegalArgumentException("Expected a module definition, got " + definition.tag());
        }
        String name = qualifiedName(definition, parent);
        if (name == null) {
            throw new IllegalArgumentException("Module definition without a name at " + definition.location());
        }

        List<SyntaxNode> statements = SyntaxNodes.body(definition);
        DirectiveScan scan = scopeTracker.scan(statements);
        if (scan.hasErrors()) {
            log.debug("Module {}: {} directive(s) skipped", name, scan.errors().size());
        }
        ExtractionScope scope = ExtractionScope.of(name, scan.directives());
        SourceLocation location = definition.location();

        List<FunctionInfo> functions = functionExtractor.extract(statements, scope);
        List<TypeDefinitionInfo> types = typeSpecExtractor.types(statements);

        ModuleInfo module = new ModuleInfo(
            name,
            moduledoc(statements),
            statements.stream().anyMatch(s -> AttributeExtractor.isDefinition(s, "moduledoc")
                && AttributeExtractor.isDocFalse(s)),
            parent,
            nestedUnits(definition).stream().map(nested -> qualifiedName(nested, name)).filter(Objects::nonNull).toList(),
            scan.directives(),
            functions.stream().filter(f -> !f.isMacro()).map(FunctionInfo::signature).toList(),
            functions.stream().filter(FunctionInfo::isMacro).map(FunctionInfo::signature).toList(),
            types.stream().map(t -> new FunctionSignature(t.name(), t.arity())).toList(),
            location);

        ModuleAnalysis.Builder builder = ModuleAnalysis.builder()
            .module(module)
            .functions(functions)
            .attributes(attributeExtractor.extract(statements))
            .types(types)
            .specs(typeSpecExtractor.specs(statements))
            .struct(structExtractor.struct(statements, scope).orElse(null))
            .exception(structExtractor.exception(statements, scope).orElse(null))
            .behaviour(behaviourExtractor.extract(statements, scope, functions, location).orElse(null))
            .genServer(otpExtractor.genServer(statements, scope, functions, location).orElse(null))
            .supervisor(otpExtractor.supervisor(statements, scope, location).orElse(null))
            .agent(otpExtractor.agent(statements, scope, location).orElse(null))
            .task(otpExtractor.task(statements, scope, location).orElse(null))
            .calls(callExtractor.extract(functions, scope))
            .controlFlows(controlFlowExtractor.extract(functions, scope))
            .anonymousFunctions(anonymousFunctionExtractor.extract(statements))
            .captures(captureExtractor.extract(statements, scope))
            .quotes(quoteExtractor.extract(statements))
            .macroInvocations(macroInvocationExtractor.extract(statements, scope, functions));

        if (definition.is(NodeTag.DEFPROTOCOL)) {
            builder.protocol(protocolExtractor.protocol(definition, name));
        } else if (definition.is(NodeTag.DEFIMPL)) {
            List<ProtocolImplementationInfo> implementations = protocolExtractor.implementations(definition, parent);
            builder.implementations(implementations);
        }

        ModuleAnalysis analysis = builder.build();
        log.debug("Extracted module {}: {} functions, {} calls", name,
            analysis.functions().size(), analysis.calls().size());
        return analysis;
    }

    /**
     * Returns the fully qualified name of a module-like definition.
     *
     * <p>{@code defmodule} names nest under the parent; {@code defimpl} is named
     * {@code Protocol.Type} after its first target type.
     *
     * @param definition module-like node
     * @param parent enclosing module name, or null
     * @return dotted name, or null when the node carries no name
     */
    public static String qualifiedName(SyntaxNode definition, String parent) {
        if (definition.is(NodeTag.DEFIMPL)) {
            String protocol = ProtocolExtractor.protocolName(definition);
            List<String> targets = ProtocolExtractor.targetTypes(definition, parent);
            if (protocol == null || targets.isEmpty()) {
                return null;
            }
            return ProtocolExtractor.implementationName(protocol, targets.get(0));
        }
        String local = definition.positional().stream()
            .filter(child -> child.is(NodeTag.MODULE_NAME))
            .map(SyntaxNode::name)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
        if (local == null) {
            return null;
        }
        if (local.startsWith("__MODULE__.") && parent != null) {
            return parent + local.substring("__MODULE__".length());
        }
        return parent == null ? local : parent + "." + local;
    }

    /**
     * Returns the module-like nodes directly nested in a definition's body.
     *
     * @param definition module-like node
     * @return nested definitions in pre-order, without their own nested definitions
     */
    public static List<SyntaxNode> nestedUnits(SyntaxNode definition) {
        List<SyntaxNode> nested = new ArrayList<>();
        for (SyntaxNode statement : SyntaxNodes.body(definition)) {
            collectNested(statement, nested);
        }
        return nested;
    }

    private static void collectNested(SyntaxNode node, List<SyntaxNode> nested) {
        if (node.tag().isModuleLike()) {
            nested.add(node);
            return;
        }
        node.children().forEach(child -> collectNested(child, nested));
    }

    private static String moduledoc(List<SyntaxNode> statements) {
        return statements.stream()
            .filter(statement -> AttributeExtractor.isDefinition(statement, "moduledoc"))
            .findFirst()
            .flatMap(AttributeExtractor::docText)
            .orElse(null);
    }
}
