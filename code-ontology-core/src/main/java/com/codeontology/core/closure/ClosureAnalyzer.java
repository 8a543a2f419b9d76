package com.codeontology.core.closure;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SourceLocation;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.ast.SyntaxNodes;
import com.codeontology.core.model.AnonymousClauseInfo;
import com.codeontology.core.model.AnonymousFunctionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the free variables of anonymous functions.
 *
 * <p>Each clause is analysed on its own. A clause binds its parameter patterns, pinned
 * variables and, in statement order, the left-hand sides of {@code =} matches in its body. A read
 * of a name that is not bound at that point is a capture. Bindings made inside block constructs
 * ({@code case}, {@code if}, {@code for}, ...) stay inside them. Nested anonymous functions are
 * analysed first; their captures count as reads of the enclosing clause.
 *
 * <p>Inside {@code quote} only {@code unquote} arguments and quote options are reads.
 *
 * <pre>{@code
 * // fn x -> x + y end
 * ClosureAnalysis analysis = new ClosureAnalyzer().analyze(fnNode);
 * analysis.freeVariableNames();   // [y]
 * analysis.boundVariables();      // [x]
 * }</pre>
 *
 * <p>Instances are stateless and safe to share.
 */
public class ClosureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ClosureAnalyzer.class);

    /**
     * Analyses an {@code ANONYMOUS_FUNCTION} node.
     *
     * @param fn anonymous function node
     * @return analysis of all clauses
     * @throws IllegalArgumentException if {@code fn} is not an anonymous function
     */
    public ClosureAnalysis analyze(SyntaxNode fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        if (!fn.is(NodeTag.ANONYMOUS_FUNCTION)) {
            throw new IllegalArgumentException("Expected ANONYMOUS_FUNCTION, got " + fn.tag());
        }
        return summarize(analyzeClauses(clausesOf(fn)), fn.location());
    }

    /**
     * Analyses an extracted anonymous function.
     *
     * @param function anonymous function record
     * @return analysis of all clauses
     */
    public ClosureAnalysis analyze(AnonymousFunctionInfo function) {
        Objects.requireNonNull(function, "function must not be null");
        return summarize(analyzeClauses(function.clauses()), function.location());
    }

    /**
     * Splits an anonymous function node into its clauses.
     *
     * @param fn {@code ANONYMOUS_FUNCTION} node
     * @return clauses in source order
     */
    public static List<AnonymousClauseInfo> clausesOf(SyntaxNode fn) {
        List<AnonymousClauseInfo> clauses = new ArrayList<>();
        for (SyntaxNode clause : fn.children()) {
            if (!clause.is(NodeTag.CLAUSE)) {
                log.debug("Skipping non-clause child {} of anonymous function", clause.tag());
                continue;
            }
            clauses.add(new AnonymousClauseInfo(
                clause.keywordValues("params"),
                clause.keywordValue("when").orElse(null),
                clause.keywordValue("do").orElse(null),
                clause.location()));
        }
        return clauses;
    }

    /**
     * Determines which enclosing scope provides each captured variable.
     *
     * @param freeVariables captured names
     * @param chain enclosing scopes, outermost first
     * @return scope analysis
     */
    public ScopeAnalysis analyzeScope(List<String> freeVariables, List<ClosureScope> chain) {
        Objects.requireNonNull(freeVariables, "freeVariables must not be null");
        Objects.requireNonNull(chain, "chain must not be null");

        Map<String, ClosureScope> sources = new LinkedHashMap<>();
        List<String> unresolved = new ArrayList<>();
        int maxDepth = 0;
        boolean crossesFunction = false;
        boolean capturesModule = false;

        for (String name : freeVariables) {
            int sourceIndex = -1;
            for (int i = chain.size() - 1; i >= 0; i--) {
                if (chain.get(i).provides(name)) {
                    sourceIndex = i;
                    break;
                }
            }
            if (sourceIndex < 0) {
                unresolved.add(name);
                continue;
            }
            ClosureScope source = chain.get(sourceIndex);
            sources.put(name, source);
            maxDepth = Math.max(maxDepth, chain.size() - sourceIndex);
            if (source.kind() == ClosureScope.Kind.MODULE) {
                capturesModule = true;
            }
            for (int j = sourceIndex + 1; j < chain.size(); j++) {
                ClosureScope.Kind kind = chain.get(j).kind();
                if (kind == ClosureScope.Kind.FUNCTION || kind == ClosureScope.Kind.CLOSURE) {
                    crossesFunction = true;
                    break;
                }
            }
        }
        return new ScopeAnalysis(sources, unresolved, maxDepth, crossesFunction, capturesModule);
    }

    // ==================== Clause analysis ====================

    private ClauseResult analyzeClauses(List<AnonymousClauseInfo> clauses) {
        ClauseResult total = new ClauseResult();
        for (AnonymousClauseInfo clause : clauses) {
            ClauseResult result = new ClauseResult();
            Set<String> scope = new HashSet<>();
            for (SyntaxNode parameter : clause.parameters()) {
                result.bindPattern(parameter, scope);
            }
            if (clause.guard() != null) {
                result.visit(clause.guard(), scope);
            }
            if (clause.body() != null) {
                result.visit(clause.body(), scope);
            }
            total.absorb(result);
        }
        return total;
    }

    private ClosureAnalysis summarize(ClauseResult result, SourceLocation capturedAt) {
        Map<String, List<VariableReference>> byName = new LinkedHashMap<>();
        for (VariableReference reference : result.free) {
            byName.computeIfAbsent(reference.name(), k -> new ArrayList<>()).add(reference);
        }
        List<FreeVariable> freeVariables = new ArrayList<>();
        byName.forEach((name, references) -> freeVariables.add(new FreeVariable(
            name,
            references.size(),
            references.stream().map(VariableReference::location).filter(Objects::nonNull).toList(),
            capturedAt)));
        log.trace("Closure analysis: {} free, {} bound", freeVariables.size(), result.bound.size());
        return new ClosureAnalysis(freeVariables, new ArrayList<>(result.bound), result.all);
    }

    /**
     * Mutable accumulator for one traversal.
     */
    private final class ClauseResult {
        private final Set<String> bound = new LinkedHashSet<>();
        private final List<VariableReference> all = new ArrayList<>();
        private final List<VariableReference> free = new ArrayList<>();

        void absorb(ClauseResult other) {
            bound.addAll(other.bound);
            all.addAll(other.all);
            free.addAll(other.free);
        }

        void read(VariableReference reference, Set<String> scope) {
            all.add(reference);
            if (!scope.contains(reference.name())) {
                free.add(reference);
            }
        }

        void bindPattern(SyntaxNode pattern, Set<String> scope) {
            Set<String> names = new LinkedHashSet<>();
            List<SyntaxNode> pinned = new ArrayList<>();
            Bindings.collect(pattern, names, pinned);
            for (SyntaxNode pin : pinned) {
                all.add(new VariableReference(pin.name(), pin.location()));
                scope.add(pin.name());
                bound.add(pin.name());
            }
            scope.addAll(names);
            bound.addAll(names);
        }

        void visit(SyntaxNode node, Set<String> scope) {
            if (node == null) {
                return;
            }
            switch (node.tag()) {
                case VARIABLE -> {
                    if (Bindings.isTrackedVariable(node.name())) {
                        read(new VariableReference(node.name(), node.location()), scope);
                    }
                }
                case PIN -> bindPattern(node, scope);
                case MATCH -> visitMatch(node, scope);
                case ANONYMOUS_FUNCTION -> {
                    ClauseResult nested = analyzeClauses(clausesOf(node));
                    nested.free.forEach(reference -> read(reference, scope));
                }
                case CLAUSE -> visitClause(node, scope, true);
                case COND -> visitCond(node, scope);
                case FOR, WITH -> visitComprehension(node, scope);
                case IF, UNLESS, CASE, RECEIVE, TRY -> visitBranching(node, scope);
                case QUOTE -> visitQuote(node, scope);
                case ATTRIBUTE, MODULE_NAME -> {
                    // module attributes and aliases are not variables
                }
                case CAPTURE -> {
                    if (SyntaxNodes.namedCaptureReference(node).isEmpty()) {
                        node.children().forEach(child -> visit(child, scope));
                    }
                }
                default -> node.children().forEach(child -> visit(child, scope));
            }
        }

        private void visitMatch(SyntaxNode match, Set<String> scope) {
            List<SyntaxNode> sides = match.children();
            if (sides.size() != 2) {
                sides.forEach(child -> visit(child, scope));
                return;
            }
            visit(sides.get(1), scope);
            bindPattern(sides.get(0), scope);
        }

        private void visitClause(SyntaxNode clause, Set<String> outer, boolean patternParams) {
            Set<String> scope = new HashSet<>(outer);
            for (SyntaxNode param : clause.keywordValues("params")) {
                if (patternParams) {
                    bindPattern(param, scope);
                } else {
                    visit(param, scope);
                }
            }
            clause.keywordValue("when").ifPresent(guard -> visit(guard, scope));
            clause.keywordValue("do").ifPresent(body -> visit(body, scope));
        }

        private void visitCond(SyntaxNode cond, Set<String> outer) {
            for (SyntaxNode clause : cond.keywordValues("do")) {
                if (clause.is(NodeTag.CLAUSE)) {
                    visitClause(clause, outer, false);
                } else {
                    visit(clause, new HashSet<>(outer));
                }
            }
        }

        private void visitComprehension(SyntaxNode node, Set<String> outer) {
            Set<String> scope = new HashSet<>(outer);
            for (SyntaxNode child : node.children()) {
                if (child.is(NodeTag.KEYWORD)) {
                    Set<String> branchScope = "else".equals(child.name()) || "into".equals(child.name())
                        ? new HashSet<>(outer)
                        : new HashSet<>(scope);
                    child.children().forEach(value -> visit(value, branchScope));
                } else if (child.is(NodeTag.OPERATOR) && "<-".equals(child.name())
                    && child.children().size() == 2) {
                    visit(child.children().get(1), scope);
                    bindPattern(child.children().get(0), scope);
                } else {
                    visit(child, scope);
                }
            }
        }

        private void visitBranching(SyntaxNode node, Set<String> outer) {
            Set<String> scope = new HashSet<>(outer);
            for (SyntaxNode child : node.children()) {
                if (child.is(NodeTag.KEYWORD)) {
                    Set<String> branchScope = new HashSet<>(scope);
                    child.children().forEach(value -> visit(value, branchScope));
                } else {
                    visit(child, scope);
                }
            }
        }

        private void visitQuote(SyntaxNode quote, Set<String> scope) {
            for (SyntaxNode child : quote.children()) {
                if (child.is(NodeTag.KEYWORD) && !"do".equals(child.name())) {
                    child.children().forEach(value -> visit(value, scope));
                } else {
                    SyntaxNodes.walk(child, inner -> {
                        if (inner.is(NodeTag.UNQUOTE) || inner.is(NodeTag.UNQUOTE_SPLICING)) {
                            inner.children().forEach(value -> visit(value, scope));
                        }
                    });
                }
            }
        }
    }
}
