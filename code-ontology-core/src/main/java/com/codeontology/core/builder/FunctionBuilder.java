package com.codeontology.core.builder;

import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.ClauseInfo;
import com.codeontology.core.model.DelegateTarget;
import com.codeontology.core.model.FunctionInfo;

import java.util.Objects;

/**
 * Builds function and macro entities together with their clauses.
 *
 * <p>The function IRI is {@code {base}{Module}/{name}/{arity}}. A function with default
 * arguments is one entity; its lowest accepted arity is recorded as {@code minArity} when it
 * differs from the arity. Clauses are built in order and share the advancing context counter.
 *
 * <pre>{@code
 * BuildResult result = new FunctionBuilder().build(function, context.withModule("MyApp.Users"));
 * result.iri();  // https://example.org/code#MyApp.Users/get_user/1
 * }</pre>
 */
public class FunctionBuilder extends AbstractEntityBuilder<FunctionInfo> {

    private final ClauseBuilder clauseBuilder;

    public FunctionBuilder() {
        this(new ClauseBuilder());
    }

    public FunctionBuilder(ClauseBuilder clauseBuilder) {
        this.clauseBuilder = Objects.requireNonNull(clauseBuilder, "clauseBuilder must not be null");
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the context names no module
     */
    @Override
    public BuildResult build(FunctionInfo function, BuildContext context) {
        Objects.requireNonNull(function, "function must not be null");
        String module = context.requireModule("FunctionBuilder");
        Iri moduleIri = context.moduleIri(module);
        Iri functionIri = IriGenerator.forFunction(context.baseIri(), module, function.name(), function.arity());

        TripleBuilder triples = new TripleBuilder()
            .type(functionIri, functionClass(function))
            .string(functionIri, Structure.FUNCTION_NAME, function.name())
            .nonNegative(functionIri, Structure.ARITY, function.arity())
            .bidirectional(functionIri, Structure.BELONGS_TO, moduleIri,
                function.isMacro() ? Structure.CONTAINS_MACRO : Structure.CONTAINS_FUNCTION)
            .string(functionIri, Structure.DOCSTRING, function.docstring())
            .flag(functionIri, Structure.IS_DOC_FALSE, function.docFalse());

        if (function.minArity() != function.arity()) {
            triples.nonNegative(functionIri, Structure.MIN_ARITY, function.minArity());
        }
        DelegateTarget delegate = function.delegate();
        if (delegate != null) {
            triples.link(functionIri, Structure.DELEGATES_TO, IriGenerator.forFunction(
                context.baseIri(), delegate.module(), delegate.function(), delegate.arity()));
        }
        addLocation(triples, functionIri, function.location(), context);

        BuildContext current = context;
        for (ClauseInfo clause : function.clauses()) {
            BuildResult built = clauseBuilder.build(functionIri, clause, current);
            triples.addAll(built.triples());
            current = built.context();
        }
        log.trace("Built {}.{}/{} with {} clauses", module, function.name(), function.arity(),
            function.clauses().size());
        return result(functionIri, triples, current);
    }

    static Iri functionClass(FunctionInfo function) {
        return switch (function.form()) {
            case GUARD -> Structure.GUARD_FUNCTION;
            case DELEGATE -> Structure.DELEGATED_FUNCTION;
            case MACRO -> function.isPublic() ? Structure.PUBLIC_MACRO : Structure.PRIVATE_MACRO;
            case FUNCTION -> function.isPublic() ? Structure.PUBLIC_FUNCTION : Structure.PRIVATE_FUNCTION;
        };
    }
}
