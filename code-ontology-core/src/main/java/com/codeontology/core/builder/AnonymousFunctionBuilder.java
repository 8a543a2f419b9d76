package com.codeontology.core.builder;

import com.codeontology.core.closure.ClosureAnalyzer;
import com.codeontology.core.context.BuildContext;
import com.codeontology.core.graph.Iri;
import com.codeontology.core.graph.IriGenerator;
import com.codeontology.core.graph.RdfList;
import com.codeontology.core.graph.RdfLists;
import com.codeontology.core.graph.TripleBuilder;
import com.codeontology.core.graph.vocab.Core;
import com.codeontology.core.graph.vocab.Structure;
import com.codeontology.core.model.AnonymousClauseInfo;
import com.codeontology.core.model.AnonymousFunctionInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@code fn ... end} entities with their clauses and captured variables.
 *
 * <p>IRIs are {@code {Module}/anon/{index}}, indexed per module in source order. The enclosing
 * function (or the module, for anonymous functions outside any function) links to it through
 * {@code containsAnonymousFunction}.
 */
public class AnonymousFunctionBuilder extends AbstractEntityBuilder<AnonymousFunctionInfo> {

    private final ClosureAnalyzer analyzer;
    private final ClosureBuilder closureBuilder;

    public AnonymousFunctionBuilder() {
        this(new ClosureAnalyzer(), new ClosureBuilder());
    }

    public AnonymousFunctionBuilder(ClosureAnalyzer analyzer, ClosureBuilder closureBuilder) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.closureBuilder = Objects.requireNonNull(closureBuilder, "closureBuilder must not be null");
    }

    @Override
    public BuildResult build(AnonymousFunctionInfo function, BuildContext context) {
        Objects.requireNonNull(function, "function must not be null");
        String module = context.requireModule("AnonymousFunctionBuilder");
        Iri moduleIri = context.moduleIri(module);
        Iri anonymousIri = IriGenerator.forAnonymousFunction(moduleIri, function.index());
        Iri containerIri = function.enclosingFunction() != null && function.enclosingArity() != null
            ? IriGenerator.forFunction(context.baseIri(), module, function.enclosingFunction(), function.enclosingArity())
            : moduleIri;

        TripleBuilder triples = new TripleBuilder()
            .type(anonymousIri, Structure.ANONYMOUS_FUNCTION)
            .nonNegative(anonymousIri, Structure.ARITY, function.arity())
            .link(containerIri, Structure.CONTAINS_ANONYMOUS_FUNCTION, anonymousIri);

        List<Iri> clauseIris = new ArrayList<>();
        List<AnonymousClauseInfo> clauses = function.clauses();
        for (int i = 0; i < clauses.size(); i++) {
            Iri clauseIri = IriGenerator.forAnonymousClause(anonymousIri, i);
            triples.type(clauseIri, Structure.FUNCTION_CLAUSE)
                .positive(clauseIri, Structure.CLAUSE_ORDER, i + 1)
                .link(anonymousIri, Structure.HAS_CLAUSE, clauseIri)
                .flag(clauseIri, Core.HAS_GUARD, clauses.get(i).hasGuard());
            clauseIris.add(clauseIri);
        }
        if (clauseIris.size() > 1) {
            RdfList list = RdfLists.build(anonymousIri, "clauses", clauseIris);
            triples.link(anonymousIri, Structure.HAS_CLAUSES, list.head()).addAll(list.triples());
        }

        triples.addAll(closureBuilder.build(anonymousIri, analyzer.analyze(function)));
        addLocation(triples, anonymousIri, function.location(), context);
        return result(anonymousIri, triples, context);
    }
}
