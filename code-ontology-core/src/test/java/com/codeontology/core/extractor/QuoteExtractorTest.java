package com.codeontology.core.extractor;

import com.codeontology.core.ast.NodeTag;
import com.codeontology.core.ast.SyntaxNode;
import com.codeontology.core.model.HygieneViolationInfo;
import com.codeontology.core.model.HygieneViolationType;
import com.codeontology.core.model.QuoteInfo;
import com.codeontology.core.model.UnquoteInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codeontology.core.ast.SyntaxNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link QuoteExtractor}.
 */
class QuoteExtractorTest {

    private final QuoteExtractor extractor = new QuoteExtractor();

    private static SyntaxNode macro(SyntaxNode body) {
        return function("defmacro", "gen", List.of(var("expr")), null, body);
    }

    @Test
    void extract_quoteWithUnquotes_recordsSplicingAndExpressions() {
        SyntaxNode quote = at(node(NodeTag.QUOTE, kw("do", call("log",
            node(NodeTag.UNQUOTE, var("expr")),
            node(NodeTag.UNQUOTE_SPLICING, var("args"))))), 4, 6);

        QuoteInfo info = extractor.extract(List.of(macro(quote))).get(0);

        assertThat(info.index()).isZero();
        assertThat(info.unquoteEnabled()).isTrue();
        assertThat(info.unquotes()).extracting(UnquoteInfo::splicing, UnquoteInfo::depth, UnquoteInfo::expression)
            .containsExactly(tuple(false, 1, "expr"), tuple(true, 1, "args"));
        assertThat(info.location().endLine()).isEqualTo(6);
    }

    @Test
    void extract_quoteOptions_areRecognized() {
        SyntaxNode quote = node(NodeTag.QUOTE,
            kw("bind_quoted", node(NodeTag.LIST, kw("value", var("value")))),
            kw("location", atom("keep")),
            kw("unquote", bool(false)),
            kw("generated", bool(true)),
            kw("context", moduleName("MyApp.Macros")),
            kw("do", var("value")));

        QuoteInfo info = extractor.extract(List.of(macro(quote))).get(0);

        assertThat(info.bindQuoted()).isTrue();
        assertThat(info.locationKeep()).isTrue();
        assertThat(info.unquoteEnabled()).isFalse();
        assertThat(info.generated()).isTrue();
        assertThat(info.context()).isEqualTo("MyApp.Macros");
    }

    @Test
    void extract_hygieneEscapes_areReported() {
        SyntaxNode quote = node(NodeTag.QUOTE, kw("do", block(
            op("=", call("var!", var("result")), integer(1)),
            call("var!", var("conn"), moduleName("Plug")),
            remoteCall("Macro", "escape", var("state")))));

        List<HygieneViolationInfo> violations = extractor.extract(List.of(macro(quote))).get(0).violations();

        assertThat(violations).extracting(HygieneViolationInfo::type, HygieneViolationInfo::variable,
                HygieneViolationInfo::context)
            .containsExactly(
                tuple(HygieneViolationType.VAR_BANG, "result", null),
                tuple(HygieneViolationType.VAR_BANG, "conn", "Plug"),
                tuple(HygieneViolationType.MACRO_ESCAPE, "state", null));
    }

    @Test
    void extract_nestedQuotes_areSeparateAndIndexed() {
        SyntaxNode inner = node(NodeTag.QUOTE, kw("do", node(NodeTag.UNQUOTE, var("y"))));
        SyntaxNode outer = node(NodeTag.QUOTE, kw("do", call("wrap", inner)));

        List<QuoteInfo> quotes = extractor.extract(List.of(macro(outer)));

        assertThat(quotes).extracting(QuoteInfo::index).containsExactly(0, 1);
        assertThat(quotes.get(0).unquotes()).isEmpty();
        assertThat(quotes.get(1).unquotes()).hasSize(1);
    }

    @Test
    void extract_noQuotes_returnsEmpty() {
        assertThat(extractor.extract(List.of(def("f", List.of(), atom("ok"))))).isEmpty();
    }
}
