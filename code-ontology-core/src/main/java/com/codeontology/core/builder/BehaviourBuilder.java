package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.BehaviourInfo;
import com.codeontology.core.model.CallbackInfo;
import com.codeontology.core.model.FunctionSignature;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds behaviour definitions and behaviour implementations.
 *
 * <p>A module declaring callbacks is a {@code Behaviour} sharing the module IRI. Callbacks live
 * at {@code {behaviour}/callback/{name}/{arity}}. A module implementing a behaviour links each
 * of its functions that matches a callback through {@code implementsCallback}; callbacks are
 * known for GenServer, Supervisor and Application, for behaviours registered with this builder
 * and for the module's own declarations.
 */
public class BehaviourBuilder extends AbstractEntityBuilder<BehaviourInfo> {

    static final Map<String, List<FunctionSignature>> KNOWN_CALLBACKS = Map.of(
        "GenServer", List.of(
            new FunctionSignature("init", 1),
            new FunctionSignature("handle_call", 3),
            new FunctionSignature("handle_cast", 2),
            new FunctionSignature("handle_info", 2),
            new FunctionSignature("handle_continue", 2),
            new FunctionSignature("terminate", 2),
            new FunctionSignature("code_change", 3),
            new FunctionSignature("format_status", 1),
            new FunctionSignature("format_status", 2)),
        "Supervisor", List.of(new FunctionSignature("init", 1)),
        "Application", List.of(
            new FunctionSignature("start", 2),
            new FunctionSignature("stop", 1),
            new FunctionSignature("config_change", 3)));

    private final Map<String, ? extends Set<FunctionSignature>> declaredCallbacks;

    public BehaviourBuilder() {
        this(Map.of());
    }

    /**
     * @param declaredCallbacks callbacks of behaviours defined elsewhere in the project, by module name
     */
    public BehaviourBuilder(Map<String, ? extends Set<FunctionSignature>> declaredCallbacks) {
        this.declaredCallbacks = Map.copyOf(Objects.requireNonNull(declaredCallbacks,
            "declaredCallbacks must not be null"));
    }

    @Override
    public BuildResult build(BehaviourInfo behaviour, BuildContext context) {
        Objects.requireNonNull(behaviour, "behaviour must not be null");
        Iri moduleIri = context.moduleIri(behaviour.module());
        TripleBuilder triples = new TripleBuilder();

        if (behaviour.definesBehaviour()) {
            triples.type(moduleIri, Structure.BEHAVIOUR)
                .link(moduleIri, Structure.DEFINES_BEHAVIOUR, moduleIri);
            for (CallbackInfo callback : behaviour.callbacks()) {
                addCallback(triples, moduleIri, callback, context);
            }
            addLocation(triples, moduleIri, behaviour.location(), context);
        }

        Set<FunctionSignature> functions = new HashSet<>(behaviour.functions());
        for (String implemented : behaviour.implementedBehaviours()) {
            Iri behaviourIri = context.moduleIri(implemented);
            triples.link(moduleIri, Structure.IMPLEMENTS_BEHAVIOUR, behaviourIri);
            for (FunctionSignature callback : callbacksOf(implemented, behaviour)) {
                if (functions.contains(callback)) {
                    triples.link(
                        IriGenerator.forFunction(context.baseIri(), behaviour.module(), callback.name(), callback.arity()),
                        Structure.IMPLEMENTS_CALLBACK,
                        IriGenerator.forCallback(behaviourIri, callback.name(), callback.arity()));
                }
            }
        }
        return result(moduleIri, triples, context);
    }

    private void addCallback(TripleBuilder triples, Iri behaviourIri, CallbackInfo callback, BuildContext context) {
        Iri callbackIri = IriGenerator.forCallback(behaviourIri, callback.name(), callback.arity());
        if (callback.macro()) {
            triples.type(callbackIri, Structure.MACRO_CALLBACK);
        } else {
            triples.type(callbackIri, Structure.CALLBACK);
        }
        if (callback.optional()) {
            triples.type(callbackIri, Structure.OPTIONAL_CALLBACK);
        }
        triples.string(callbackIri, Structure.FUNCTION_NAME, callback.name())
            .nonNegative(callbackIri, Structure.ARITY, callback.arity())
            .string(callbackIri, Structure.DOCSTRING, callback.docstring())
            .link(behaviourIri, Structure.DEFINES_CALLBACK, callbackIri);
        addLocation(triples, callbackIri, callback.location(), context);
    }

    private Set<FunctionSignature> callbacksOf(String behaviourModule, BehaviourInfo implementor) {
        Set<FunctionSignature> callbacks = new HashSet<>(KNOWN_CALLBACKS.getOrDefault(behaviourModule, List.of()));
        Set<FunctionSignature> declared = declaredCallbacks.get(behaviourModule);
        if (declared != null) {
            callbacks.addAll(declared);
        }
        if (behaviourModule.equals(implementor.module())) {
            implementor.callbacks().forEach(callback -> callbacks.add(callback.signature()));
        }
        return callbacks;
    }
}
