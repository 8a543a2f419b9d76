package com.codeontology.core.closure;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ClosureAnalyzer}.
 */
class ClosureAnalyzerTest {

    private final ClosureAnalyzer analyzer = new ClosureAnalyzer();

    @Test
    void analyze_outerVariable_isFree() {
        // fn x -> x + y end
        SyntaxNode fn = fn(clause(List.of(var("x")), null, op("+", var("x"), var("y"))));

        ClosureAnalysis analysis = analyzer.analyze(fn);

        assertThat(analysis.freeVariableNames()).containsExactly("y");
        assertThat(analysis.boundVariables()).containsExactly("x");
        assertThat(analysis.allReferences()).extracting(VariableReference::name).containsExactly("x", "y");
        assertThat(analysis.hasCaptures()).isTrue();
    }

    @Test
    void analyze_namedCaptureInBody_isNotAVariable() {
        // fn items -> Enum.map(items, &format/1) end
        SyntaxNode fn = fn(clause(List.of(var("items")), null,
            remoteCall("Enum", "map", var("items"), capture(op("/", var("format"), integer(1))))));

        ClosureAnalysis analysis = analyzer.analyze(fn);

        assertThat(analysis.freeVariableNames()).isEmpty();
        assertThat(analysis.hasCaptures()).isFalse();
    }

    @Test
    void analyze_shorthandCaptureInBody_readsOuterVariables() {
        // fn items -> Enum.map(items, &(&1 * factor)) end
        SyntaxNode fn = fn(clause(List.of(var("items")), null,
            remoteCall("Enum", "map", var("items"), capture(op("*", placeholder(1), var("factor"))))));

        assertThat(analyzer.analyze(fn).freeVariableNames()).containsExactly("factor");
    }

    @Test
    void analyze_repeatedReference_countsOccurrences() {
        SyntaxNode fn = fn(clause(List.of(), null,
            op("+", at(var("total"), 2), op("*", at(var("total"), 3), integer(2)))));

        FreeVariable total = analyzer.analyze(fn).freeVariables().get(0);

        assertThat(total.referenceCount()).isEqualTo(2);
        assertThat(total.referenceLocations()).extracting(l -> l.startLine()).containsExactly(2, 3);
    }

    @Test
    void analyze_matchInBody_bindsLeftSide() {
        // fn -> a = b; a end
        SyntaxNode fn = fn(clause(List.of(), null,
            block(node(NodeTag.MATCH, var("a"), var("b")), var("a"))));

        ClosureAnalysis analysis = analyzer.analyze(fn);

        assertThat(analysis.freeVariableNames()).containsExactly("b");
        assertThat(analysis.boundVariables()).contains("a");
    }

    @Test
    void analyze_pinnedParameter_isNotFree() {
        SyntaxNode fn = fn(clause(List.of(node(NodeTag.PIN, var("expected"))), null, var("expected")));

        ClosureAnalysis analysis = analyzer.analyze(fn);

        assertThat(analysis.hasCaptures()).isFalse();
        assertThat(analysis.boundVariables()).containsExactly("expected");
    }

    @Test
    void analyze_nestedFunction_propagatesOnlyOuterFreeVariables() {
        // fn x -> fn y -> x + y + z end end
        SyntaxNode inner = fn(clause(List.of(var("y")), null, op("+", op("+", var("x"), var("y")), var("z"))));
        SyntaxNode outer = fn(clause(List.of(var("x")), null, inner));

        assertThat(analyzer.analyze(outer).freeVariableNames()).containsExactly("z");
    }

    @Test
    void analyze_underscoreAndSpecialForms_areIgnored() {
        SyntaxNode fn = fn(clause(List.of(var("_unused")), null,
            node(NodeTag.TUPLE, var("_ignored"), var("__MODULE__"), attribute("timeout", null))));

        ClosureAnalysis analysis = analyzer.analyze(fn);

        assertThat(analysis.freeVariables()).isEmpty();
        assertThat(analysis.boundVariables()).isEmpty();
    }

    @Test
    void analyze_caseClause_bindsBranchPatterns() {
        SyntaxNode caseNode = node(NodeTag.CASE, var("x"),
            kw("do", clause(List.of(var("v")), null, op("+", var("v"), var("w")))));
        SyntaxNode fn = fn(clause(List.of(var("x")), null, caseNode));

        assertThat(analyzer.analyze(fn).freeVariableNames()).containsExactly("w");
    }

    @Test
    void analyze_comprehensionGenerator_bindsPattern() {
        // fn -> for item <- items, do: item * factor end
        SyntaxNode forNode = node(NodeTag.FOR, op("<-", var("item"), var("items")),
            kw("do", op("*", var("item"), var("factor"))));
        SyntaxNode fn = fn(clause(List.of(), null, forNode));

        assertThat(analyzer.analyze(fn).freeVariableNames()).containsExactly("items", "factor");
    }

    @Test
    void analyze_multipleClauses_mergesResults() {
        SyntaxNode fn = fn(
            clause(List.of(atom("ok")), null, var("a")),
            clause(List.of(var("other")), null, var("b")));

        ClosureAnalysis analysis = analyzer.analyze(fn);

        assertThat(analysis.freeVariableNames()).containsExactly("a", "b");
        assertThat(analysis.totalCaptureCount()).isEqualTo(2);
    }

    @Test
    void analyze_notAnonymousFunction_throwsException() {
        assertThatThrownBy(() -> analyzer.analyze(var("x")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ANONYMOUS_FUNCTION");
    }

    @Test
    void analyzeScope_variableFromEnclosingFunction_crossesBoundary() {
        List<ClosureScope> chain = List.of(
            new ClosureScope(ClosureScope.Kind.MODULE, "M", Set.of("config"), null),
            new ClosureScope(ClosureScope.Kind.FUNCTION, "run/1", Set.of("a"), null),
            new ClosureScope(ClosureScope.Kind.CLOSURE, "anon", Set.of(), null));

        ScopeAnalysis scope = analyzer.analyzeScope(List.of("a", "missing"), chain);

        assertThat(scope.variableSources()).containsOnlyKeys("a");
        assertThat(scope.variableSources().get("a").kind()).isEqualTo(ClosureScope.Kind.FUNCTION);
        assertThat(scope.unresolved()).containsExactly("missing");
        assertThat(scope.captureDepth()).isEqualTo(2);
        assertThat(scope.crossesFunctionBoundary()).isTrue();
        assertThat(scope.capturesModuleAttributes()).isFalse();
    }

    @Test
    void analyzeScope_moduleVariable_reportsModuleCapture() {
        List<ClosureScope> chain = List.of(
            new ClosureScope(ClosureScope.Kind.MODULE, "M", Set.of("config"), null),
            new ClosureScope(ClosureScope.Kind.BLOCK, "if", Set.of("local"), null));

        ScopeAnalysis scope = analyzer.analyzeScope(List.of("config", "local"), chain);

        assertThat(scope.captureDepth()).isEqualTo(2);
        assertThat(scope.capturesModuleAttributes()).isTrue();
        assertThat(scope.crossesFunctionBoundary()).isFalse();
    }

    @Test
    void boundBy_defaultArgumentAndInOperator_bindLeftOnly() {
        assertThat(Bindings.boundBy(op("\\\\", var("opts"), var("defaults")))).containsExactly("opts");
        assertThat(Bindings.boundBy(op("in", var("e"), moduleName("ArgumentError")))).containsExactly("e");
        assertThat(Bindings.boundBy(node(NodeTag.TUPLE, atom("ok"), var("value"), node(NodeTag.WILDCARD))))
            .containsExactly("value");
    }
}
