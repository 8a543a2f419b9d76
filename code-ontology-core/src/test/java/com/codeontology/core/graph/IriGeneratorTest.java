package com.codeontology.core.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IriGenerator}.
 */
class IriGeneratorTest {

    private static final String BASE = "https://example.org/code#";

    @Test
    void forModule_dottedName_keepsDots() {
        assertThat(IriGenerator.forModule(BASE, "MyApp.Users").value())
            .isEqualTo("https://example.org/code#MyApp.Users");
    }

    @Test
    void forModule_elixirPrefix_isDropped() {
        assertThat(IriGenerator.forModule(BASE, "Elixir.MyApp.Users"))
            .isEqualTo(IriGenerator.forModule(BASE, "MyApp.Users"));
    }

    @Test
    void forFunction_withPunctuation_escapesName() {
        Iri iri = IriGenerator.forFunction(BASE, "MyApp.Users", "valid?", 1);

        assertThat(iri.value()).isEqualTo("https://example.org/code#MyApp.Users/valid%3F/1");
    }

    @Test
    void forFunction_sameInputs_returnsEqualIris() {
        assertThat(IriGenerator.forFunction(BASE, "M", "f", 1))
            .isEqualTo(IriGenerator.forFunction(BASE, "M", "f", 1));
    }

    @Test
    void forFunction_negativeArity_throwsException() {
        assertThatThrownBy(() -> IriGenerator.forFunction(BASE, "M", "f", -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("arity");
    }

    @Test
    void forFunction_blankBase_throwsException() {
        assertThatThrownBy(() -> IriGenerator.forFunction(" ", "M", "f", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseIri");
    }

    @Test
    void forClauseAndParameter_useZeroBasedPathIndices() {
        Iri function = IriGenerator.forFunction(BASE, "MyApp.Users", "get_user", 1);
        Iri clause = IriGenerator.forClause(function, 0);
        Iri parameter = IriGenerator.forParameter(clause, 0);

        assertThat(parameter.value()).isEqualTo("https://example.org/code#MyApp.Users/get_user/1/clause/0/param/0");
    }

    @Test
    void forSourceLocation_buildsLineRangeUnderFile() {
        Iri file = IriGenerator.forSourceFile(BASE, "lib\\users.ex");

        assertThat(IriGenerator.forSourceLocation(file, 10, 25).value())
            .isEqualTo("https://example.org/code#file/lib/users.ex/L10-25");
    }

    @Test
    void forRepository_usesEightCharacterHash() {
        Iri repo = IriGenerator.forRepository(BASE, "https://github.com/acme/my_app");

        assertThat(repo.value()).matches("https://example\\.org/code#repo/[a-f0-9]{8}");
    }

    @Test
    void forCall_placesCallUnderCallerPath() {
        assertThat(IriGenerator.forCall(BASE, "M", "g", 0, 2).value())
            .isEqualTo("https://example.org/code#call/M/g/0/2");
    }

    @Test
    void forControlFlow_prefixesKind() {
        assertThat(IriGenerator.forControlFlow(BASE, "case", "M", "f", 1, 0).value())
            .isEqualTo("https://example.org/code#case/M/f/1/0");
    }

    @Test
    void forAttribute_withoutIndex_omitsSuffix() {
        assertThat(IriGenerator.forAttribute(BASE, "M", "moduledoc", null).value())
            .isEqualTo("https://example.org/code#M/attribute/moduledoc");
        assertThat(IriGenerator.forAttribute(BASE, "M", "tag", 3).value())
            .isEqualTo("https://example.org/code#M/attribute/tag/3");
    }

    @Test
    void forProtocolImplementation_joinsWithFor() {
        assertThat(IriGenerator.forProtocolImplementation(BASE, "String.Chars", "MyApp.User").value())
            .isEqualTo("https://example.org/code#String.Chars.for.MyApp.User");
    }

    @Test
    void forCapture_usesAmpersandSegment() {
        assertThat(IriGenerator.forCapture(Iri.of(BASE + "MyApp"), 2).value())
            .isEqualTo("https://example.org/code#MyApp/&/2");
        assertThat(IriGenerator.forCapture(Iri.of(BASE + "MyApp"), 0))
            .isNotEqualTo(IriGenerator.forFunction(BASE, "MyApp", "capture", 0));
    }

    @Test
    void forExpression_usesCounter() {
        assertThat(IriGenerator.forExpression(BASE, 7).value()).isEqualTo("https://example.org/code#expr/7");
    }

    @Test
    void forExpression_withModule_isScopedToModule() {
        assertThat(IriGenerator.forExpression(BASE, "Elixir.MyApp.Users", 0).value())
            .isEqualTo("https://example.org/code#expr/MyApp.Users/0");
        assertThat(IriGenerator.forExpression(BASE, "MyApp.Orders", 0))
            .isNotEqualTo(IriGenerator.forExpression(BASE, "MyApp.Users", 0));
        assertThat(IriGenerator.forExpression(BASE, null, 3)).isEqualTo(IriGenerator.forExpression(BASE, 3));
    }

    @ParameterizedTest
    @CsvSource({
        "valid?, valid%3F",
        "update!, update%21",
        "+, %2B",
        "snake_case.ok-1, snake_case.ok-1",
        "ü, %C3%BC"
    })
    void escapeName_roundTripsThroughUnescape(String raw, String escaped) {
        assertThat(IriGenerator.escapeName(raw)).isEqualTo(escaped);
        assertThat(IriGenerator.unescapeName(escaped)).isEqualTo(raw);
    }
}
