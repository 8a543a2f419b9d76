package com.codeontology.core.extractor;

import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.directive.DirectiveKind;
import com.codeontology.core.model.BehaviourInfo;
import com.codeontology.core.model.CallbackInfo;
import com.codeontology.core.model.FunctionInfo;
import com.codeontology.core.model.FunctionSignature;
import com.codeontology.core.model.FunctionSpecInfo;
import com.codeontology.core.model.SpecKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts behaviour declarations ({@code @callback}, {@code @macrocallback}) and the behaviours
 * a module adopts through {@code @behaviour} or an OTP {@code use}.
 */
public class BehaviourExtractor {

    /** Modules whose {@code use} makes the caller implement the behaviour of the same name. */
    static final Set<String> BEHAVIOUR_USES = Set.of("GenServer", "Supervisor", "DynamicSupervisor", "Application");

    private final TypeSpecExtractor typeSpecs;

    public BehaviourExtractor() {
        this(new TypeSpecExtractor());
    }

    public BehaviourExtractor(TypeSpecExtractor typeSpecs) {
        this.typeSpecs = typeSpecs;
    }

    /**
     * Extracts behaviour facts.
     *
     * @param statements module body statements
     * @param scope module scope
     * @param functions functions of the module
     * @param location module location
     * @return behaviour info, or empty when the module neither declares nor adopts a behaviour
     */
    public Optional<BehaviourInfo> extract(List<SyntaxNode> statements, ExtractionScope scope,
                                           List<FunctionInfo> functions, SourceLocation location) {
        List<CallbackInfo> callbacks = callbacks(statements);
        List<String> implemented = implementedBehaviours(statements, scope);
        if (callbacks.isEmpty() && implemented.isEmpty()) {
            return Optional.empty();
        }
        List<FunctionSignature> publicFunctions = functions.stream()
            .filter(FunctionInfo::isPublic)
            .map(FunctionInfo::signature)
            .toList();
        return Optional.of(new BehaviourInfo(scope.module(), callbacks, implemented, publicFunctions, location));
    }

    private List<CallbackInfo> callbacks(List<SyntaxNode> statements) {
        Set<FunctionSignature> optional = TypeSpecExtractor.optionalCallbacks(statements);
        List<CallbackInfo> callbacks = new ArrayList<>();
        String pendingDoc = null;
        for (SyntaxNode statement : statements) {
            if (AttributeExtractor.isDefinition(statement, "doc")) {
                pendingDoc = AttributeExtractor.docText(statement).orElse(null);
                continue;
            }
            if (!AttributeExtractor.isDefinition(statement, "callback")
                && !AttributeExtractor.isDefinition(statement, "macrocallback")) {
                continue;
            }
            for (FunctionSpecInfo spec : typeSpecs.specs(List.of(statement))) {
                callbacks.add(new CallbackInfo(
                    spec.name(),
                    spec.arity(),
                    spec.kind() == SpecKind.MACROCALLBACK,
                    optional.contains(spec.signature()),
                    pendingDoc,
                    spec.location()));
            }
            pendingDoc = null;
        }
        return callbacks;
    }

    private static List<String> implementedBehaviours(List<SyntaxNode> statements, ExtractionScope scope) {
        Set<String> behaviours = new LinkedHashSet<>();
        for (SyntaxNode statement : statements) {
            if (AttributeExtractor.isDefinition(statement, "behaviour")
                || AttributeExtractor.isDefinition(statement, "behavior")) {
                scope.resolveModule(statement.children().get(0)).ifPresent(behaviours::add);
            }
        }
        for (String used : scope.modulesOf(DirectiveKind.USE)) {
            if (BEHAVIOUR_USES.contains(used)) {
                behaviours.add(used);
            }
        }
        return List.copyOf(behaviours);
    }
}
