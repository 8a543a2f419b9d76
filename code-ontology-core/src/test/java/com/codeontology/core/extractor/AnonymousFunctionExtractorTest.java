package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.model.AnonymousFunctionInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AnonymousFunctionExtractor}.
 */
class AnonymousFunctionExtractorTest {

    private final AnonymousFunctionExtractor extractor = new AnonymousFunctionExtractor();

    @Test
    void extract_fnInsideFunction_recordsEnclosingFunction() {
        SyntaxNode fn = at(fn(clause(List.of(var("x")), null, op("*", var("x"), var("factor")))), 3);
        SyntaxNode scale = def("scale", List.of(var("items"), var("factor")),
            remoteCall("Enum", "map", var("items"), fn));

        List<AnonymousFunctionInfo> found = extractor.extract(List.of(scale));

        assertThat(found).singleElement().satisfies(info -> {
            assertThat(info.index()).isZero();
            assertThat(info.enclosingFunction()).isEqualTo("scale");
            assertThat(info.enclosingArity()).isEqualTo(2);
            assertThat(info.arity()).isEqualTo(1);
            assertThat(info.location().startLine()).isEqualTo(3);
        });
    }

    @Test
    void extract_multiClauseFn_keepsEveryClause() {
        SyntaxNode fn = fn(
            clause(List.of(atom("ok")), null, integer(1)),
            clause(List.of(var("other")), call("is_atom", var("other")), integer(2)));

        AnonymousFunctionInfo info = extractor.extract(List.of(def("f", List.of(), fn))).get(0);

        assertThat(info.clauses()).hasSize(2);
        assertThat(info.clauses().get(1).hasGuard()).isTrue();
    }

    @Test
    void extract_nestedFns_areIndexedInVisitOrder() {
        SyntaxNode inner = fn(clause(List.of(var("y")), null, var("y")));
        SyntaxNode outer = fn(clause(List.of(var("x")), null, inner));

        List<AnonymousFunctionInfo> found = extractor.extract(List.of(def("g", List.of(), outer)));

        assertThat(found).extracting(AnonymousFunctionInfo::index).containsExactly(0, 1);
        assertThat(found).allSatisfy(info -> assertThat(info.enclosingFunction()).isEqualTo("g"));
    }

    @Test
    void extract_moduleLevelFn_hasNoEnclosingFunction() {
        SyntaxNode fn = fn(clause(List.of(), null, atom("ok")));

        AnonymousFunctionInfo info = extractor.extract(List.of(attribute("handler", fn))).get(0);

        assertThat(info.enclosingFunction()).isNull();
        assertThat(info.enclosingArity()).isNull();
        assertThat(info.arity()).isZero();
    }

    @Test
    void extract_fnInsideQuote_isIgnored() {
        SyntaxNode quoted = node(NodeTag.QUOTE, kw("do", fn(clause(List.of(), null, atom("ok")))));

        assertThat(extractor.extract(List.of(def("m", List.of(), quoted)))).isEmpty();
    }
}
